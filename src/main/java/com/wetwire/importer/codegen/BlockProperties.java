package com.wetwire.importer.codegen;

import java.util.Map;
import java.util.Optional;

/**
 * Array-valued properties whose elements are extracted into their own declarations.
 *
 * Keyed by resource type, then property name, to the nested element type
 * name under the owning resource class.
 */
public final class BlockProperties {

    private static final Map<String, Map<String, String>> BLOCK_TYPES = Map.of(
            "AWS::EC2::SecurityGroup", Map.of(
                    "SecurityGroupIngress", "Ingress",
                    "SecurityGroupEgress", "Egress"));

    private BlockProperties() {
        // Utility class
    }

    /**
     * Nested element type name for a block-worthy property, e.g. "Ingress".
     */
    public static Optional<String> elementType(String resourceType, String propertyName) {
        return Optional.ofNullable(BLOCK_TYPES.getOrDefault(resourceType, Map.of()).get(propertyName));
    }

    public static boolean isBlockProperty(String resourceType, String propertyName) {
        return elementType(resourceType, propertyName).isPresent();
    }
}
