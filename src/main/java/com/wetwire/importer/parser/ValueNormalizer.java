package com.wetwire.importer.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IntrinsicFactory;
import com.wetwire.importer.model.IntrinsicKind;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.parser.tree.TreeMapping;
import com.wetwire.importer.parser.tree.TreeNode;
import com.wetwire.importer.parser.tree.TreeScalar;
import com.wetwire.importer.parser.tree.TreeSequence;

/**
 * Converts value positions of the generic tree into IR values.
 *
 * Short-form tags and single-key {@code Fn::} maps both go through
 * {@link IntrinsicFactory}, so either syntax yields equal intrinsics.
 */
public class ValueNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ValueNormalizer.class);

    private final ToolDiagnostics diagnostics;

    public ValueNormalizer(ToolDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    public IrValue normalize(TreeNode node) {
        if (node == null) {
            return IrScalar.NULL;
        }
        if (node.isTagged()) {
            return normalizeTagged(node);
        }
        return normalizeUntagged(node);
    }

    private IrValue normalizeTagged(TreeNode node) {
        String tag = node.getTag();
        IrValue rawArgs = normalizeUntagged(node);
        Optional<IntrinsicKind> kind = IntrinsicKind.fromTag(tag);
        if (kind.isPresent()) {
            Optional<Intrinsic> intrinsic = IntrinsicFactory.create(kind.get(), rawArgs);
            if (intrinsic.isPresent()) {
                return intrinsic.get();
            }
            warn("Malformed arguments for " + tag + ": " + rawArgs);
        } else {
            warn("Unknown tag " + tag + " treated as a literal");
        }

        if (node instanceof TreeScalar scalar) {
            return IrScalar.string(scalar.text() == null ? "" : scalar.text());
        }
        return IrScalar.NULL;
    }

    private IrValue normalizeUntagged(TreeNode node) {
        if (node instanceof TreeScalar scalar) {
            return IrScalar.of(scalar.getValue());
        }
        if (node instanceof TreeSequence sequence) {
            List<IrValue> items = new ArrayList<>();
            for (TreeNode item : sequence.getItems()) {
                items.add(normalize(item));
            }
            return new IrList(items);
        }
        if (node instanceof TreeMapping mapping) {
            return normalizeMapping(mapping);
        }
        throw new IllegalStateException("Unexpected tree node: " + node.getClass().getSimpleName());
    }

    private IrValue normalizeMapping(TreeMapping mapping) {
        Map<String, IrValue> entries = new LinkedHashMap<>();
        mapping.getEntries().forEach((key, value) -> entries.put(key, normalize(value)));

        if (entries.size() == 1) {
            Map.Entry<String, IrValue> only = entries.entrySet().iterator().next();
            Optional<IntrinsicKind> kind = IntrinsicKind.fromLongFormKey(only.getKey());
            if (kind.isPresent()) {
                Optional<Intrinsic> intrinsic = IntrinsicFactory.create(kind.get(), only.getValue());
                if (intrinsic.isPresent()) {
                    return intrinsic.get();
                }
                warn("Malformed arguments for " + only.getKey() + ": " + only.getValue() + "; kept as a map");
            }
        }
        return new IrMap(entries);
    }

    private void warn(String message) {
        log.warn(message);
        diagnostics.addWarning(message);
    }
}
