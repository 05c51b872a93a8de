package com.wetwire.importer.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.lang.model.SourceVersion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.util.NamingUtil;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;

/**
 * Extracts tag lists and block-worthy array elements into their own declarations.
 *
 * Each extracted element becomes a member emitted right before its owning
 * resource; the property itself becomes a list of those member names.
 * Elements that cannot be extracted stay inline in the list.
 */
public class PropertyBlockExtractor {

    private static final Logger log = LoggerFactory.getLogger(PropertyBlockExtractor.class);

    private static final String TAG_PREFIX = "Tag";
    private static final List<String> NAME_LIKE_KEYS = List.of("Name", "Key", "Type", "DeviceName", "PolicyName");

    private final GenerationContext context;
    private final ValueRenderer values;

    public PropertyBlockExtractor(GenerationContext context, ValueRenderer values) {
        this.context = context;
        this.values = values;
    }

    /**
     * Extracts each {Key, Value} element of a tag list into a {@code Tag.of(key, value)} member.
     *
     * @param declarations receives the extracted member declarations
     * @return the rendered property value
     */
    public String extractTags(IrList tags, int indent, List<String> declarations) {
        List<String> items = new ArrayList<>();
        for (IrValue element : tags.getItems()) {
            if (element instanceof IrMap tag && tag.containsKey("Key") && tag.containsKey("Value")) {
                String key = tag.get("Key").asString();
                String name = context.claimBlockName(TAG_PREFIX + NamingUtil.cleanForName(key));
                String tagType = context.runtimeType("Tag");
                int argIndent = DeclarationWriter.MEMBER_INDENT + ValueRenderer.CONTINUATION_INDENT;
                String initializer = values.call(tagType + ".of", List.of(
                        values.render(tag.get("Key"), argIndent),
                        values.render(tag.get("Value"), argIndent)), DeclarationWriter.MEMBER_INDENT);
                declarations.add(DeclarationWriter.member(tagType, name, initializer));
                items.add(name);
            } else {
                log.debug("Tag element of {} kept inline: {}", context.getCurrentResource(), element);
                items.add(values.render(element, indent + ValueRenderer.CONTINUATION_INDENT));
            }
        }
        return list(items, indent);
    }

    /**
     * Extracts each map element of a block-worthy property into a typed builder member.
     *
     * @param elementType qualified nested type of the elements
     * @param declarations receives the extracted member declarations
     * @return the rendered property value
     */
    public String extractBlocks(IrList elements, String elementType, int indent, List<String> declarations) {
        List<String> items = new ArrayList<>();
        for (IrValue element : elements.getItems()) {
            if (element instanceof IrMap block && block.getEntries().keySet().stream().allMatch(SourceVersion::isIdentifier)) {
                String name = context.claimBlockName(blockSuffix(block));
                String typeName = context.getImportManager().reference(elementType);
                String initializer = values.renderTypedMap(block, elementType, DeclarationWriter.MEMBER_INDENT);
                declarations.add(DeclarationWriter.member(typeName, name, initializer));
                items.add(name);
            } else {
                log.debug("Block element of {} kept inline: {}", context.getCurrentResource(), element);
                items.add(values.render(element, indent + ValueRenderer.CONTINUATION_INDENT));
            }
        }
        return list(items, indent);
    }

    /**
     * Descriptive name suffix for a block, or null when nothing distinguishes it.
     */
    static String blockSuffix(IrMap block) {
        String ports = portSuffix(block);
        if (ports != null) {
            return ports;
        }
        for (String key : NAME_LIKE_KEYS) {
            String value = block.containsKey(key) ? block.get(key).asString() : null;
            String cleaned = NamingUtil.cleanForName(value);
            if (!cleaned.isEmpty()) {
                return cleaned;
            }
        }
        return null;
    }

    private static String portSuffix(IrMap block) {
        String from = scalarText(block.get("FromPort"));
        if (from == null) {
            return null;
        }
        String to = scalarText(block.get("ToPort"));
        String suffix = to == null || to.equals(from)
                ? "Port" + portText(from)
                : "Ports" + portText(from) + "To" + portText(to);

        String protocol = block.containsKey("IpProtocol") ? block.get("IpProtocol").asString() : null;
        if (protocol != null && !protocol.equals("tcp")) {
            suffix += "-1".equals(protocol) ? "All" : NamingUtil.cleanForName(protocol).toUpperCase(Locale.ROOT);
        }
        return suffix;
    }

    private static String portText(String port) {
        return "-1".equals(port) ? "All" : NamingUtil.cleanForName(port);
    }

    private static String scalarText(IrValue value) {
        if (value instanceof IrScalar scalar && scalar.getValue() != null) {
            return scalar.asText();
        }
        return null;
    }

    private String list(List<String> items, int indent) {
        if (items.isEmpty()) {
            return context.listType() + ".of()";
        }
        return values.call(context.listType() + ".of", items, indent);
    }
}
