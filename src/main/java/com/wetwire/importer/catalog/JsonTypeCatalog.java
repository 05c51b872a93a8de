package com.wetwire.importer.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Catalog loaded from a JSON document:
 *
 * <pre>
 * {
 *   "resources": {
 *     "AWS::S3::Bucket": { "type": "dev.wetwire.aws.resources.s3.Bucket", "properties": ["BucketName"] }
 *   },
 *   "nested": {
 *     "dev.wetwire.aws.resources.s3.Bucket": { "VersioningConfiguration": "dev.wetwire.aws.resources.s3.Bucket.VersioningConfiguration" }
 *   }
 * }
 * </pre>
 */
public class JsonTypeCatalog implements TypeCatalog {

    private static final Logger log = LoggerFactory.getLogger(JsonTypeCatalog.class);

    private final Map<String, ResourceTypeInfo> resources;
    private final Map<String, Map<String, String>> nested;

    private JsonTypeCatalog(Map<String, ResourceTypeInfo> resources, Map<String, Map<String, String>> nested) {
        this.resources = resources;
        this.nested = nested;
    }

    public static JsonTypeCatalog load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read type catalog " + path + ": " + e.getMessage(), e);
        }
    }

    public static JsonTypeCatalog load(InputStream in, String sourceName) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(in);
        } catch (IOException e) {
            throw new CatalogLoadException("Invalid JSON in type catalog " + sourceName + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CatalogLoadException("Type catalog " + sourceName + " must be a JSON object");
        }

        Map<String, ResourceTypeInfo> resources = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> resourceFields = root.path("resources").fields();
        while (resourceFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = resourceFields.next();
            JsonNode type = entry.getValue().get("type");
            if (type == null || !type.isTextual() || type.asText().isBlank()) {
                throw new CatalogLoadException("Type catalog " + sourceName + ": resource "
                        + entry.getKey() + " has no \"type\"");
            }
            ResourceTypeInfo.ResourceTypeInfoBuilder info = ResourceTypeInfo.builder().qualifiedName(type.asText());
            entry.getValue().path("properties").forEach(name -> info.propertyName(name.asText()));
            resources.put(entry.getKey(), info.build());
        }

        Map<String, Map<String, String>> nested = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> nestedFields = root.path("nested").fields();
        while (nestedFields.hasNext()) {
            Map.Entry<String, JsonNode> owner = nestedFields.next();
            Map<String, String> properties = new HashMap<>();
            owner.getValue().fields().forEachRemaining(p -> properties.put(p.getKey(), p.getValue().asText()));
            nested.put(owner.getKey(), properties);
        }

        log.info("Loaded type catalog {} ({} resource types)", sourceName, resources.size());
        return new JsonTypeCatalog(resources, nested);
    }

    @Override
    public Optional<ResourceTypeInfo> lookup(String resourceType) {
        return Optional.ofNullable(resources.get(resourceType));
    }

    @Override
    public Optional<String> lookupNested(String qualifiedTypeName, String propertyName) {
        return Optional.ofNullable(nested.getOrDefault(qualifiedTypeName, Map.of()).get(propertyName));
    }

    public int size() {
        return resources.size();
    }
}
