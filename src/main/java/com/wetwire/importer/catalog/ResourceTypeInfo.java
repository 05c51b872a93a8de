package com.wetwire.importer.catalog;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Catalog entry for one resource type.
 */
@Value
@Builder
public class ResourceTypeInfo {

    /** Fully qualified Java class name, e.g. {@code dev.wetwire.aws.resources.s3.Bucket}. */
    @NonNull
    String qualifiedName;

    /** Declared top-level properties; empty means the catalog does not restrict them. */
    @Singular
    List<String> propertyNames;

    public boolean declaresProperty(String propertyName) {
        return propertyNames.isEmpty() || propertyNames.contains(propertyName);
    }

    public String getSimpleName() {
        return qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
    }
}
