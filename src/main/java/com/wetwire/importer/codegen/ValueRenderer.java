package com.wetwire.importer.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import javax.lang.model.SourceVersion;

import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.util.NamingUtil;
import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.IrValueVisitor;
import com.wetwire.importer.model.PseudoParameter;

/**
 * Renders IR values as Java expressions.
 *
 * Maps become typed builders when the catalog knows a nested type for the
 * (owner type, property) pair and every key is a valid identifier; otherwise
 * they become untyped {@code Map.ofEntries(...)} literals, and everything
 * below an untyped map stays untyped.
 *
 * Every method takes the indent of the line the expression starts on;
 * continuation lines are indented one step further.
 */
public class ValueRenderer {

    static final int CONTINUATION_INDENT = 8;
    private static final int MAX_LINE_WIDTH = 100;

    /** Properties whose map values are always rendered untyped. */
    private static final Set<String> UNTYPED_PROPERTIES = Set.of("Tags", "Metadata");

    private final GenerationContext context;
    private final IntrinsicRenderer intrinsicRenderer;

    public ValueRenderer(GenerationContext context) {
        this.context = context;
        this.intrinsicRenderer = new IntrinsicRenderer(context, this);
    }

    /**
     * Renders a value without type information.
     */
    public String render(IrValue value, int indent) {
        return render(value, null, null, indent);
    }

    /**
     * Renders a value found under {@code propertyName} of the type {@code ownerType}.
     *
     * @param ownerType qualified name of the owning resource or nested type, or null for untyped
     */
    public String render(IrValue value, String ownerType, String propertyName, int indent) {
        return value.accept(new ScopedRenderer(ownerType, propertyName, indent));
    }

    /**
     * Renders a map as a builder of the given nested type, keys sorted.
     */
    public String renderTypedMap(IrMap map, String qualifiedType, int indent) {
        String typeName = context.getImportManager().reference(qualifiedType);
        int callIndent = indent + CONTINUATION_INDENT;
        List<String> calls = new ArrayList<>();
        for (String key : map.sortedKeys()) {
            String value = render(map.get(key), qualifiedType, key, callIndent);
            calls.add("." + NamingUtil.toSetterName(key) + "(" + value + ")");
        }
        return chain(typeName + ".builder()", calls, indent);
    }

    /**
     * Renders a map as an untyped {@code Map.ofEntries(...)} literal, keeping key order.
     */
    public String renderUntypedMap(IrMap map, int indent) {
        String mapType = context.mapType();
        if (map.isEmpty()) {
            return mapType + ".of()";
        }
        int itemIndent = indent + CONTINUATION_INDENT;
        List<String> entries = new ArrayList<>();
        for (Map.Entry<String, IrValue> entry : map.getEntries().entrySet()) {
            String value = render(entry.getValue(), itemIndent);
            entries.add(mapType + ".entry(" + quote(entry.getKey()) + ", " + value + ")");
        }
        return call(mapType + ".ofEntries", entries, indent);
    }

    public String renderScalar(IrScalar scalar) {
        Object value = scalar.getValue();
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            Optional<PseudoParameter> pseudo = PseudoParameter.fromTemplateName(text);
            if (pseudo.isPresent()) {
                context.useIntrinsics();
                return pseudo.get().getConstantName();
            }
            return quote(text);
        }
        if (value instanceof Long number) {
            boolean fitsInt = number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE;
            return fitsInt ? number.toString() : number + "L";
        }
        if (value instanceof Double number) {
            return Double.toString(number);
        }
        return value.toString();
    }

    /**
     * Lays out {@code callee(arg, ...)} on one line when it fits, otherwise
     * one argument per continuation line.
     */
    public String call(String callee, List<String> args, int indent) {
        if (args.isEmpty()) {
            return callee + "()";
        }
        String inline = callee + "(" + String.join(", ", args) + ")";
        if (!inline.contains("\n") && indent + inline.length() <= MAX_LINE_WIDTH) {
            return inline;
        }
        String pad = " ".repeat(indent + CONTINUATION_INDENT);
        StringBuilder sb = new StringBuilder(callee).append("(");
        for (int i = 0; i < args.size(); i++) {
            sb.append('\n').append(pad).append(args.get(i));
            if (i < args.size() - 1) {
                sb.append(',');
            }
        }
        return sb.append(')').toString();
    }

    /**
     * Lays out a builder chain, one call per continuation line, ending in {@code .build()}.
     */
    public String chain(String head, List<String> calls, int indent) {
        if (calls.isEmpty()) {
            return head + ".build()";
        }
        String pad = " ".repeat(indent + CONTINUATION_INDENT);
        StringBuilder sb = new StringBuilder(head);
        for (String call : calls) {
            sb.append('\n').append(pad).append(call);
        }
        return sb.append('\n').append(pad).append(".build()").toString();
    }

    /**
     * Java string literal for the given text.
     */
    public static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    private boolean allKeysValidIdentifiers(IrMap map) {
        return map.getEntries().keySet().stream().allMatch(SourceVersion::isIdentifier);
    }

    private final class ScopedRenderer implements IrValueVisitor<String> {

        private final String ownerType;
        private final String propertyName;
        private final int indent;

        ScopedRenderer(String ownerType, String propertyName, int indent) {
            this.ownerType = ownerType;
            this.propertyName = propertyName;
            this.indent = indent;
        }

        @Override
        public String visitScalar(IrScalar scalar) {
            return renderScalar(scalar);
        }

        @Override
        public String visitList(IrList list) {
            String listType = context.listType();
            if (list.isEmpty()) {
                return listType + ".of()";
            }
            String elementProperty = NamingUtil.singular(propertyName);
            int itemIndent = indent + CONTINUATION_INDENT;
            List<String> items = new ArrayList<>();
            for (IrValue item : list.getItems()) {
                items.add(render(item, ownerType, elementProperty, itemIndent));
            }
            return call(listType + ".of", items, indent);
        }

        @Override
        public String visitMap(IrMap map) {
            if (ownerType != null && propertyName != null && !UNTYPED_PROPERTIES.contains(propertyName)
                    && allKeysValidIdentifiers(map)) {
                Optional<String> nested = context.getCatalog().lookupNested(ownerType, propertyName);
                if (nested.isPresent()) {
                    return renderTypedMap(map, nested.get(), indent);
                }
            }
            return renderUntypedMap(map, indent);
        }

        @Override
        public String visitIntrinsic(Intrinsic intrinsic) {
            return intrinsicRenderer.render(intrinsic, indent);
        }
    }
}
