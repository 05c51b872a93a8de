package com.wetwire.importer.model;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A fully normalized template.
 *
 * Every section is keyed by logical id and keeps the order in which the
 * entities appeared in the source.
 */
@Value
@Builder
public class Template {

    public static final String DEFAULT_FORMAT_VERSION = "2010-09-09";

    String sourceName;
    String description;

    @Builder.Default
    String formatVersion = DEFAULT_FORMAT_VERSION;

    @Singular
    Map<String, Parameter> parameters;

    @Singular
    Map<String, Mapping> mappings;

    @Singular
    Map<String, Condition> conditions;

    @Singular
    Map<String, Resource> resources;

    @Singular
    Map<String, Output> outputs;

    public boolean hasResource(String logicalId) {
        return resources.containsKey(logicalId);
    }

    public boolean hasParameter(String logicalId) {
        return parameters.containsKey(logicalId);
    }

    /**
     * True if the id names any entity declared in this template.
     */
    public boolean isDeclared(String logicalId) {
        return parameters.containsKey(logicalId)
                || resources.containsKey(logicalId)
                || mappings.containsKey(logicalId)
                || conditions.containsKey(logicalId)
                || outputs.containsKey(logicalId);
    }
}
