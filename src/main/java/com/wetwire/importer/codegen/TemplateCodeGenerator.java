package com.wetwire.importer.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.context.GeneratorConfig;
import com.wetwire.importer.model.Condition;
import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IntrinsicKind;
import com.wetwire.importer.model.IrMap;
import com.wetwire.importer.model.IrValue;
import com.wetwire.importer.model.Mapping;
import com.wetwire.importer.model.Output;
import com.wetwire.importer.model.Parameter;
import com.wetwire.importer.model.Template;

import freemarker.template.Configuration;
import freemarker.template.TemplateException;

/**
 * Generates the Java class holding every declaration of an imported template.
 *
 * Member order: parameters, mappings, conditions, resources (each preceded by
 * its extracted blocks, in dependency order), outputs. Parameters are rendered
 * last so that only the ones actually referenced are declared.
 */
public class TemplateCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(TemplateCodeGenerator.class);

    private static final String CLASS_TEMPLATE = "java/stack-class.ftl";

    private final Configuration freemarkerConfig;

    public TemplateCodeGenerator(Configuration freemarkerConfig) {
        this.freemarkerConfig = freemarkerConfig;
    }

    /**
     * Generates the source files for the context's template.
     *
     * @return relative file path to source text
     */
    public Map<String, String> generate(GenerationContext context) {
        Template template = context.getTemplate();
        ValueRenderer values = new ValueRenderer(context);
        ResourceDeclarationGenerator resources = new ResourceDeclarationGenerator(context, values);

        List<String> resourceMembers = new ArrayList<>();
        for (String id : context.getResourceOrder()) {
            resourceMembers.addAll(resources.generate(template.getResources().get(id)));
        }

        List<String> mappingMembers = new ArrayList<>();
        for (String id : new TreeSet<>(template.getMappings().keySet())) {
            mappingMembers.add(generateMapping(context, values, template.getMappings().get(id)));
        }

        List<String> conditionMembers = new ArrayList<>();
        for (String id : new TreeSet<>(template.getConditions().keySet())) {
            conditionMembers.add(generateCondition(context, values, template.getConditions().get(id)));
        }

        List<String> outputMembers = new ArrayList<>();
        for (String id : new TreeSet<>(template.getOutputs().keySet())) {
            outputMembers.add(generateOutput(context, values, template.getOutputs().get(id)));
        }

        List<String> parameterMembers = new ArrayList<>();
        for (String id : new TreeSet<>(template.getParameters().keySet())) {
            if (context.isParameterNeeded(id)) {
                parameterMembers.add(generateParameter(context, template.getParameters().get(id)));
            } else {
                log.debug("Dropping unreferenced parameter {}", id);
            }
        }

        List<String> members = new ArrayList<>();
        members.addAll(parameterMembers);
        members.addAll(mappingMembers);
        members.addAll(conditionMembers);
        members.addAll(resourceMembers);
        members.addAll(outputMembers);

        GeneratorConfig config = context.getConfig();
        String source = renderClass(context, members);
        String path = config.getPackageName().replace('.', '/') + "/" + config.getClassName() + ".java";

        Map<String, String> files = new LinkedHashMap<>();
        files.put(path, source);
        log.info("  Generated {} ({} members)", path, members.size());
        return files;
    }

    private String generateParameter(GenerationContext context, Parameter parameter) {
        context.useIntrinsics();
        String name = context.memberName(parameter.getLogicalId());
        String declaration = DeclarationWriter.member(context.runtimeType("Parameter"), name,
                "param(" + ValueRenderer.quote(parameter.getLogicalId()) + ")");
        if (parameter.getDescription() != null && !parameter.getDescription().isBlank()) {
            return DeclarationWriter.comment(name + " - " + parameter.getDescription()) + "\n" + declaration;
        }
        return declaration;
    }

    private String generateMapping(GenerationContext context, ValueRenderer values, Mapping mapping) {
        Map<String, IrValue> table = new LinkedHashMap<>();
        mapping.getEntries().forEach((topKey, row) -> table.put(topKey, new IrMap(row)));
        String initializer = values.renderUntypedMap(new IrMap(table), DeclarationWriter.MEMBER_INDENT);
        String type = context.mapType() + "<String, Object>";
        return DeclarationWriter.member(type, context.mappingName(mapping.getLogicalId()), initializer);
    }

    private String generateCondition(GenerationContext context, ValueRenderer values, Condition condition) {
        IrValue expression = condition.getExpression();
        String initializer = values.render(expression, DeclarationWriter.MEMBER_INDENT);
        boolean helperCall = expression instanceof Intrinsic intrinsic
                && intrinsic.getKind() != IntrinsicKind.REF
                && intrinsic.getKind() != IntrinsicKind.GET_ATT;
        String type = helperCall ? context.runtimeType("Intrinsic") : "Object";
        return DeclarationWriter.member(type, context.conditionName(condition.getLogicalId()), initializer);
    }

    private String generateOutput(GenerationContext context, ValueRenderer values, Output output) {
        int callIndent = DeclarationWriter.MEMBER_INDENT + ValueRenderer.CONTINUATION_INDENT;
        List<String> calls = new ArrayList<>();
        calls.add(".value(" + values.render(output.getValue(), callIndent) + ")");
        if (output.getDescription() != null) {
            calls.add(".description(" + ValueRenderer.quote(output.getDescription()) + ")");
        }
        if (output.getExportName() != null) {
            calls.add(".exportName(" + values.render(output.getExportName(), callIndent) + ")");
        }
        if (output.getCondition() != null) {
            calls.add(".condition(" + ValueRenderer.quote(output.getCondition()) + ")");
        }
        String type = context.runtimeType("Output");
        String initializer = values.chain(type + ".builder()", calls, DeclarationWriter.MEMBER_INDENT);
        return DeclarationWriter.member(type, context.outputName(output.getLogicalId()), initializer);
    }

    private String renderClass(GenerationContext context, List<String> members) {
        Template template = context.getTemplate();
        Map<String, Object> model = new HashMap<>();
        model.put("packageName", context.getConfig().getPackageName());
        model.put("className", context.getConfig().getClassName());
        model.put("sourceName", template.getSourceName() == null ? "template" : template.getSourceName());
        model.put("descriptionLines", descriptionLines(template.getDescription()));
        model.put("imports", context.getImportManager().getImports());
        model.put("staticImports", context.getImportManager().getStaticImports());
        model.put("members", members);

        try {
            StringWriter out = new StringWriter();
            freemarkerConfig.getTemplate(CLASS_TEMPLATE).process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + CLASS_TEMPLATE + ": " + e.getMessage(), e);
        }
    }

    private List<String> descriptionLines(String description) {
        List<String> lines = new ArrayList<>();
        if (description == null || description.isBlank()) {
            return lines;
        }
        for (String line : description.strip().split("\\R")) {
            lines.add(line.replace("*/", "*&#47;").stripTrailing());
        }
        return lines;
    }
}
