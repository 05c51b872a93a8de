package com.wetwire.importer.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.parser.tree.TreeMapping;
import com.wetwire.importer.parser.tree.TreeNode;

/**
 * Turns raw template bytes into a generic tree.
 *
 * YAML is tried first since it covers both short-form tags and most JSON;
 * strict JSON decoding is the fallback.
 */
public class TemplateDecoder {

    private static final Logger log = LoggerFactory.getLogger(TemplateDecoder.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final YamlTreeDecoder yamlDecoder;
    private final JsonTreeDecoder jsonDecoder;

    public TemplateDecoder() {
        this(new YamlTreeDecoder(), new JsonTreeDecoder());
    }

    public TemplateDecoder(YamlTreeDecoder yamlDecoder, JsonTreeDecoder jsonDecoder) {
        this.yamlDecoder = yamlDecoder;
        this.jsonDecoder = jsonDecoder;
    }

    /**
     * Decodes the content into its root mapping.
     *
     * @throws TemplateParseException for foreign formats or content that is neither YAML nor JSON
     */
    public TreeMapping decode(byte[] content, String sourceName) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        ForeignFormatDetector.checkContent(text);

        TreeMapping root;
        try {
            root = asRootMapping(yamlDecoder.decode(text));
            log.debug("Decoded {} as YAML", sourceName);
        } catch (RuntimeException yamlFailure) {
            log.debug("YAML decoding of {} failed, trying JSON: {}", sourceName, yamlFailure.getMessage());
            try {
                root = asRootMapping(jsonDecoder.decode(text.getBytes(StandardCharsets.UTF_8)));
                log.debug("Decoded {} as JSON", sourceName);
            } catch (IOException | RuntimeException jsonFailure) {
                TemplateParseException failure =
                        new TemplateParseException("failed to parse template as YAML or JSON", jsonFailure);
                failure.addSuppressed(yamlFailure);
                throw failure;
            }
        }

        ForeignFormatDetector.checkRoot(root);
        return root;
    }

    private TreeMapping asRootMapping(TreeNode node) {
        if (node instanceof TreeMapping mapping) {
            return mapping;
        }
        throw new TemplateParseException("template root must be a mapping");
    }
}
