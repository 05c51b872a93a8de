package com.wetwire.importer.catalog;

import java.util.Optional;

/**
 * Read-only view of the typed resource library the generated code compiles against.
 */
public interface TypeCatalog {

    /**
     * Resolves a canonical type string such as {@code AWS::S3::Bucket}.
     */
    Optional<ResourceTypeInfo> lookup(String resourceType);

    /**
     * Resolves the nested property type of a (qualified type, property) pair.
     *
     * @param qualifiedTypeName qualified name of the owning resource or nested type
     * @param propertyName      property name as written in the template
     * @return the qualified nested type name, or empty if the property is untyped
     */
    Optional<String> lookupNested(String qualifiedTypeName, String propertyName);
}
