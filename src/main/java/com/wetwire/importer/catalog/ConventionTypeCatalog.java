package com.wetwire.importer.catalog;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import javax.lang.model.SourceVersion;

/**
 * Catalog derived purely from naming conventions of the generated resource library.
 *
 * {@code AWS::S3::Bucket} resolves to {@code <runtime>.resources.s3.Bucket}, and a
 * nested property type is always {@code <Resource>.<Property>}, except for properties
 * holding free-form JSON documents. Property types are flat per resource: a property
 * of {@code Distribution.DistributionConfig} is still a member of {@code Distribution}.
 * Property lists are left open.
 */
public class ConventionTypeCatalog implements TypeCatalog {

    private static final String PROVIDER_PREFIX = "AWS::";

    private static final Set<String> FREE_FORM_PROPERTIES = Set.of(
            "PolicyDocument",
            "AssumeRolePolicyDocument",
            "KeyPolicy",
            "Policy",
            "PolicyText",
            "Definition",
            "DefinitionSubstitutions",
            "Metadata",
            "Tags",
            "Variables",
            "Parameters");

    private final String runtimePackage;

    public ConventionTypeCatalog(String runtimePackage) {
        this.runtimePackage = runtimePackage;
    }

    @Override
    public Optional<ResourceTypeInfo> lookup(String resourceType) {
        if (resourceType == null || !resourceType.startsWith(PROVIDER_PREFIX)) {
            return Optional.empty();
        }
        String[] parts = resourceType.split("::");
        if (parts.length != 3 || !SourceVersion.isIdentifier(parts[1]) || !SourceVersion.isIdentifier(parts[2])
                || SourceVersion.isKeyword(parts[1].toLowerCase(Locale.ROOT))) {
            return Optional.empty();
        }
        String qualifiedName = runtimePackage + ".resources."
                + parts[1].toLowerCase(Locale.ROOT) + "." + parts[2];
        return Optional.of(ResourceTypeInfo.builder().qualifiedName(qualifiedName).build());
    }

    @Override
    public Optional<String> lookupNested(String qualifiedTypeName, String propertyName) {
        if (qualifiedTypeName == null || FREE_FORM_PROPERTIES.contains(propertyName)
                || !SourceVersion.isIdentifier(propertyName)) {
            return Optional.empty();
        }
        return Optional.of(resourceClass(qualifiedTypeName) + "." + propertyName);
    }

    /**
     * Qualified name up to the first capitalized segment, the resource class.
     */
    static String resourceClass(String qualifiedTypeName) {
        String[] segments = qualifiedTypeName.split("\\.");
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            if (sb.length() > 0) {
                sb.append('.');
            }
            sb.append(segment);
            if (!segment.isEmpty() && Character.isUpperCase(segment.charAt(0))) {
                break;
            }
        }
        return sb.toString();
    }
}
