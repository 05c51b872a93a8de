package com.wetwire.importer.parser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wetwire.importer.parser.tree.TreeMapping;
import com.wetwire.importer.parser.tree.TreeNode;
import com.wetwire.importer.parser.tree.TreeScalar;
import com.wetwire.importer.parser.tree.TreeSequence;

/**
 * Decodes JSON into the generic tree. JSON has no tags, so intrinsics only
 * appear in their {@code Fn::} map form.
 */
public class JsonTreeDecoder {

    private final ObjectMapper objectMapper;

    public JsonTreeDecoder() {
        this(new ObjectMapper());
    }

    public JsonTreeDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IOException if the content is not a JSON document
     */
    public TreeNode decode(byte[] content) throws IOException {
        JsonNode root = objectMapper.readTree(content);
        if (root == null || root.isMissingNode()) {
            return null;
        }
        return convert(root);
    }

    private TreeNode convert(JsonNode node) {
        if (node.isObject()) {
            Map<String, TreeNode> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), convert(field.getValue()));
            }
            return new TreeMapping(entries);
        }
        if (node.isArray()) {
            List<TreeNode> items = new ArrayList<>();
            node.forEach(item -> items.add(convert(item)));
            return new TreeSequence(items);
        }
        if (node.isNull()) {
            return new TreeScalar(null);
        }
        if (node.isBoolean()) {
            return new TreeScalar(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new TreeScalar(node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new TreeScalar(node.doubleValue());
        }
        return new TreeScalar(node.asText());
    }
}
