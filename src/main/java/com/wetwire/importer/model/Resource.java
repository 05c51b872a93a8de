package com.wetwire.importer.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A resource declaration: type, ordered properties and the resource attributes.
 */
@Value
@Builder
public class Resource {

    @NonNull
    String logicalId;

    /** Canonical type string, e.g. {@code AWS::S3::Bucket}. */
    @NonNull
    String type;

    @Singular
    Map<String, IrValue> properties;

    @Singular("dependency")
    List<String> dependsOn;

    String condition;
    String deletionPolicy;
    String updateReplacePolicy;
    IrMap metadata;

    /**
     * Service segment of the type, e.g. "S3" for {@code AWS::S3::Bucket}.
     */
    public String service() {
        String[] parts = type.split("::");
        return parts.length == 3 ? parts[1] : "";
    }

    /**
     * Last segment of the type, e.g. "Bucket" for {@code AWS::S3::Bucket}.
     */
    public String typeName() {
        String[] parts = type.split("::");
        return parts[parts.length - 1];
    }
}
