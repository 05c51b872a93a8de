package com.wetwire.importer.parser;

import java.io.StringReader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

import com.wetwire.importer.parser.tree.TreeMapping;
import com.wetwire.importer.parser.tree.TreeNode;
import com.wetwire.importer.parser.tree.TreeScalar;
import com.wetwire.importer.parser.tree.TreeSequence;

/**
 * Decodes YAML into the generic tree, keeping local tags such as {@code !Ref}.
 *
 * Uses SnakeYAML's composer rather than its constructor so that unknown tags
 * survive instead of failing construction.
 */
public class YamlTreeDecoder {

    private static final Logger log = LoggerFactory.getLogger(YamlTreeDecoder.class);

    private static final String LOCAL_TAG_PREFIX = "!";

    private final LoaderOptions loaderOptions;

    public YamlTreeDecoder() {
        this.loaderOptions = new LoaderOptions();
        this.loaderOptions.setAllowDuplicateKeys(true);
    }

    /**
     * Decodes one YAML document.
     *
     * @return the root node, or null for an empty document
     * @throws RuntimeException (SnakeYAML's {@code YAMLException} or {@link TemplateParseException})
     *         if the content is not YAML
     */
    public TreeNode decode(String content) {
        Yaml yaml = new Yaml(loaderOptions);
        Node root = yaml.compose(new StringReader(content));
        if (root == null) {
            return null;
        }
        return convert(root);
    }

    private TreeNode convert(Node node) {
        String tag = localTag(node);
        if (node instanceof ScalarNode scalar) {
            if (tag != null) {
                return new TreeScalar(scalar.getValue(), tag);
            }
            return new TreeScalar(resolveScalar(scalar));
        }
        if (node instanceof SequenceNode sequence) {
            List<TreeNode> items = new ArrayList<>();
            for (Node item : sequence.getValue()) {
                items.add(convert(item));
            }
            return new TreeSequence(items, tag);
        }
        if (node instanceof MappingNode mapping) {
            Map<String, TreeNode> entries = new LinkedHashMap<>();
            convertMapping(mapping, entries);
            return new TreeMapping(entries, tag);
        }
        throw new TemplateParseException("unsupported YAML node: " + node.getNodeId());
    }

    private void convertMapping(MappingNode mapping, Map<String, TreeNode> entries) {
        for (NodeTuple tuple : mapping.getValue()) {
            Node keyNode = tuple.getKeyNode();
            if (Tag.MERGE.equals(keyNode.getTag())) {
                mergeInto(tuple.getValueNode(), entries);
                continue;
            }
            if (!(keyNode instanceof ScalarNode key)) {
                throw new TemplateParseException("mapping keys must be scalars at " + keyNode.getStartMark());
            }
            entries.put(key.getValue(), convert(tuple.getValueNode()));
        }
    }

    private void mergeInto(Node source, Map<String, TreeNode> entries) {
        if (source instanceof MappingNode merged) {
            Map<String, TreeNode> mergedEntries = new LinkedHashMap<>();
            convertMapping(merged, mergedEntries);
            mergedEntries.forEach(entries::putIfAbsent);
        } else if (source instanceof SequenceNode sequence) {
            for (Node item : sequence.getValue()) {
                mergeInto(item, entries);
            }
        }
    }

    private String localTag(Node node) {
        String value = node.getTag().getValue();
        return value.startsWith(LOCAL_TAG_PREFIX) ? value : null;
    }

    private Object resolveScalar(ScalarNode scalar) {
        String text = scalar.getValue();
        Tag tag = scalar.getTag();
        if (Tag.NULL.equals(tag)) {
            return null;
        }
        if (Tag.BOOL.equals(tag)) {
            String lower = text.toLowerCase(Locale.ROOT);
            if ("true".equals(lower)) {
                return Boolean.TRUE;
            }
            if ("false".equals(lower)) {
                return Boolean.FALSE;
            }
            return text;
        }
        if (Tag.INT.equals(tag)) {
            return parseInteger(text);
        }
        if (Tag.FLOAT.equals(tag)) {
            return parseFloat(text);
        }
        return text;
    }

    /**
     * Integers with a leading zero stay strings: account ids and similar
     * digit strings must keep their zeros.
     */
    private Object parseInteger(String text) {
        String cleaned = text.replace("_", "");
        String sign = "";
        String digits = cleaned;
        if (digits.startsWith("-") || digits.startsWith("+")) {
            sign = digits.startsWith("-") ? "-" : "";
            digits = digits.substring(1);
        }
        try {
            if (digits.startsWith("0x")) {
                return toNumber(new BigInteger(sign + digits.substring(2), 16));
            }
            if (digits.startsWith("0b")) {
                return toNumber(new BigInteger(sign + digits.substring(2), 2));
            }
            if (digits.startsWith("0o")) {
                return toNumber(new BigInteger(sign + digits.substring(2), 8));
            }
            if ((digits.length() > 1 && digits.startsWith("0")) || digits.contains(":")) {
                return text;
            }
            return toNumber(new BigInteger(sign + digits));
        } catch (NumberFormatException e) {
            log.debug("Keeping '{}' as a string: {}", text, e.getMessage());
            return text;
        }
    }

    private Object toNumber(BigInteger value) {
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }

    private Object parseFloat(String text) {
        String cleaned = text.replace("_", "");
        if (cleaned.toLowerCase(Locale.ROOT).contains("inf") || cleaned.toLowerCase(Locale.ROOT).contains("nan")) {
            return text;
        }
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            log.debug("Keeping '{}' as a string: {}", text, e.getMessage());
            return text;
        }
    }
}
