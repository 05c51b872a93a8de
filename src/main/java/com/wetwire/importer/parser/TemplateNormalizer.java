package com.wetwire.importer.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.Condition;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrScalar;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.Mapping;
import com.wetwire.importer.model.Output;
import com.wetwire.importer.model.Parameter;
import com.wetwire.importer.model.Resource;
import com.wetwire.importer.model.Template;
import com.wetwire.importer.parser.tree.TreeMapping;
import com.wetwire.importer.parser.tree.TreeNode;
import com.wetwire.importer.parser.tree.TreeScalar;
import com.wetwire.importer.parser.tree.TreeSequence;

/**
 * Reads the template sections from a decoded tree into the IR.
 *
 * Section maps and entity definitions are read structurally; only value
 * positions (properties, defaults, expressions, output values) are handed to
 * {@link ValueNormalizer}, so a resource attribute named {@code Condition} is
 * never mistaken for an intrinsic.
 */
public class TemplateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TemplateNormalizer.class);

    static final String FOR_EACH_PREFIX = "Fn::ForEach::";

    private final ToolDiagnostics diagnostics;
    private final ValueNormalizer values;

    public TemplateNormalizer(ToolDiagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.values = new ValueNormalizer(diagnostics);
    }

    public Template normalize(TreeMapping root, String sourceName) {
        Template.TemplateBuilder builder = Template.builder().sourceName(sourceName);

        String formatVersion = text(root.get("AWSTemplateFormatVersion"));
        if (formatVersion != null) {
            builder.formatVersion(formatVersion);
        }
        builder.description(text(root.get("Description")));

        section(root, "Parameters").forEach((id, node) -> {
            if (node instanceof TreeMapping definition) {
                builder.parameter(id, parseParameter(id, definition));
            } else {
                skip("parameter", id);
            }
        });

        section(root, "Mappings").forEach((id, node) -> {
            if (node instanceof TreeMapping definition) {
                builder.mapping(id, parseMapping(id, definition));
            } else {
                skip("mapping", id);
            }
        });

        section(root, "Conditions").forEach((id, node) ->
                builder.condition(id, Condition.builder()
                        .logicalId(id)
                        .expression(values.normalize(node))
                        .build()));

        section(root, "Resources").forEach((id, node) -> {
            if (id.startsWith(FOR_EACH_PREFIX)) {
                log.debug("Skipping loop construct {}", id);
            } else if (node instanceof TreeMapping definition && text(definition.get("Type")) != null) {
                builder.resource(id, parseResource(id, definition));
            } else {
                skip("resource", id);
            }
        });

        section(root, "Outputs").forEach((id, node) -> {
            if (id.startsWith(FOR_EACH_PREFIX)) {
                log.debug("Skipping loop construct {}", id);
            } else if (node instanceof TreeMapping definition) {
                builder.output(id, parseOutput(id, definition));
            } else {
                skip("output", id);
            }
        });

        return builder.build();
    }

    private Parameter parseParameter(String id, TreeMapping definition) {
        Parameter.ParameterBuilder builder = Parameter.builder()
                .logicalId(id)
                .description(text(definition.get("Description")))
                .allowedPattern(text(definition.get("AllowedPattern")))
                .minLength(text(definition.get("MinLength")))
                .maxLength(text(definition.get("MaxLength")))
                .minValue(text(definition.get("MinValue")))
                .maxValue(text(definition.get("MaxValue")))
                .constraintDescription(text(definition.get("ConstraintDescription")))
                .noEcho("true".equalsIgnoreCase(text(definition.get("NoEcho"))));

        String type = text(definition.get("Type"));
        if (type != null) {
            builder.type(type);
        }
        if (definition.containsKey("Default")) {
            builder.defaultValue(values.normalize(definition.get("Default")));
        }
        TreeNode allowed = definition.get("AllowedValues");
        if (allowed != null) {
            IrValue normalized = values.normalize(allowed);
            if (normalized instanceof IrList list) {
                builder.allowedValues(list.getItems());
            } else {
                builder.allowedValue(normalized);
            }
        }
        return builder.build();
    }

    private Mapping parseMapping(String id, TreeMapping definition) {
        Mapping.MappingBuilder builder = Mapping.builder().logicalId(id);
        definition.getEntries().forEach((topKey, node) -> {
            if (node instanceof TreeMapping second) {
                Map<String, IrValue> row = new LinkedHashMap<>();
                second.getEntries().forEach((key, value) -> row.put(key, values.normalize(value)));
                builder.entry(topKey, Collections.unmodifiableMap(row));
            } else {
                log.debug("Dropping non-map entry {} of mapping {}", topKey, id);
            }
        });
        return builder.build();
    }

    private Resource parseResource(String id, TreeMapping definition) {
        Resource.ResourceBuilder builder = Resource.builder()
                .logicalId(id)
                .type(text(definition.get("Type")))
                .condition(text(definition.get("Condition")))
                .deletionPolicy(text(definition.get("DeletionPolicy")))
                .updateReplacePolicy(text(definition.get("UpdateReplacePolicy")));

        if (definition.get("Properties") instanceof TreeMapping properties) {
            properties.getEntries().forEach((name, node) -> builder.property(name, values.normalize(node)));
        }

        TreeNode dependsOn = definition.get("DependsOn");
        if (dependsOn instanceof TreeSequence sequence) {
            for (TreeNode item : sequence.getItems()) {
                String target = text(item);
                if (target != null) {
                    builder.dependency(target);
                }
            }
        } else if (text(dependsOn) != null) {
            builder.dependency(text(dependsOn));
        }

        if (definition.containsKey("Metadata") && values.normalize(definition.get("Metadata")) instanceof IrMap metadata) {
            builder.metadata(metadata);
        }
        return builder.build();
    }

    private Output parseOutput(String id, TreeMapping definition) {
        Output.OutputBuilder builder = Output.builder()
                .logicalId(id)
                .value(values.normalize(definition.get("Value")))
                .description(text(definition.get("Description")))
                .condition(text(definition.get("Condition")));

        if (definition.get("Export") instanceof TreeMapping export && export.containsKey("Name")) {
            builder.exportName(values.normalize(export.get("Name")));
        }
        return builder.build();
    }

    private Map<String, TreeNode> section(TreeMapping root, String name) {
        TreeNode node = root.get(name);
        if (node instanceof TreeMapping mapping) {
            return mapping.getEntries();
        }
        if (node != null) {
            warn("Section " + name + " is not a mapping; ignored");
        }
        return Map.of();
    }

    private String text(TreeNode node) {
        if (node instanceof TreeScalar scalar && scalar.getValue() != null) {
            return IrScalar.of(scalar.getValue()).asText();
        }
        return null;
    }

    private void skip(String kind, String id) {
        warn("Skipping " + kind + " " + id + ": definition is not a valid mapping");
    }

    private void warn(String message) {
        log.warn(message);
        diagnostics.addWarning(message);
    }
}
