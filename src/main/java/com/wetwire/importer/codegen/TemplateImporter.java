package com.wetwire.importer.codegen;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.analysis.CycleDetector;
import com.wetwire.importer.analysis.DanglingReference;
import com.wetwire.importer.analysis.ReferenceAnalyzer;
import com.wetwire.importer.analysis.ReferenceGraph;
import com.wetwire.importer.analysis.ReferenceValidator;
import com.wetwire.importer.analysis.TopologicalSorter;
import com.wetwire.importer.catalog.ConventionTypeCatalog;
import com.wetwire.importer.catalog.TypeCatalog;
import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.context.GeneratorConfig;
import com.wetwire.importer.codegen.project.PomGenerator;
import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.Template;
import com.wetwire.importer.parser.TemplateDecoder;
import com.wetwire.importer.parser.TemplateNormalizer;
import com.wetwire.importer.parser.TemplateParseException;
import com.wetwire.importer.parser.tree.TreeMapping;

import freemarker.template.Configuration;
import freemarker.template.TemplateExceptionHandler;

/**
 * Runs the whole import pipeline: decode, normalize, analyze, order, generate.
 *
 * Holds only immutable configuration; every run gets its own
 * {@link GenerationContext}, so one importer can serve concurrent callers.
 */
public class TemplateImporter {

    private static final Logger log = LoggerFactory.getLogger(TemplateImporter.class);

    private static final String SCAFFOLD_SOURCE_ROOT = "src/main/java/";

    private final GeneratorConfig config;
    private final TypeCatalog catalog;
    private final TemplateDecoder decoder;
    private final TemplateCodeGenerator codeGenerator;
    private final PomGenerator pomGenerator;

    public TemplateImporter(GeneratorConfig config) {
        this(config, new ConventionTypeCatalog(config.resolveFor("").getRuntimePackage()));
    }

    public TemplateImporter(GeneratorConfig config, TypeCatalog catalog) {
        this.config = config;
        this.catalog = catalog;
        this.decoder = new TemplateDecoder();
        Configuration freemarkerConfig = createFreemarkerConfig();
        this.codeGenerator = new TemplateCodeGenerator(freemarkerConfig);
        this.pomGenerator = new PomGenerator(freemarkerConfig);
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * Imports one template.
     *
     * @param content    raw template bytes (YAML or JSON)
     * @param sourceName file name, used for diagnostics and default naming
     * @throws TemplateParseException if the content cannot be decoded or is a foreign format
     */
    public ImportResult importTemplate(byte[] content, String sourceName) {
        log.info("Starting import of {}...", sourceName);
        ToolDiagnostics diagnostics = new ToolDiagnostics();
        GeneratorConfig runConfig = config.resolveFor(sourceName);

        log.info("Step 1: Decoding template...");
        TreeMapping root = decoder.decode(content, sourceName);

        log.info("Step 2: Normalizing template...");
        Template template = new TemplateNormalizer(diagnostics).normalize(root, sourceName);
        log.info("  Parameters: {}, mappings: {}, conditions: {}, resources: {}, outputs: {}",
                template.getParameters().size(), template.getMappings().size(),
                template.getConditions().size(), template.getResources().size(), template.getOutputs().size());

        log.info("Step 3: Analyzing references...");
        ReferenceGraph graph = new ReferenceAnalyzer().analyze(template);

        log.info("Step 4: Ordering resources...");
        List<String> order = TopologicalSorter.resourceOrder(template, graph);

        if (runConfig.isStrict()) {
            log.info("Step 4.5: Running strict checks...");
            runStrictChecks(template, graph, diagnostics);
        }

        log.info("Step 5: Generating code...");
        GenerationContext context = new GenerationContext(template, runConfig, catalog, graph, order, diagnostics);
        SortedMap<String, String> files = new TreeMap<>();
        for (Map.Entry<String, String> file : codeGenerator.generate(context).entrySet()) {
            String path = runConfig.isScaffold() ? SCAFFOLD_SOURCE_ROOT + file.getKey() : file.getKey();
            files.put(path, file.getValue());
        }

        if (runConfig.isScaffold()) {
            log.info("Step 6: Generating pom.xml...");
            files.put("pom.xml", pomGenerator.generatePomContent(new PomGenerator.PomInfo(
                    runConfig.getPackageName(),
                    runConfig.getPackageName().replace('.', '-').replace('_', '-'),
                    "0.1.0",
                    runConfig.getClassName(),
                    template.getDescription() == null ? "Imported from " + sourceName : template.getDescription())));
        }

        int parameterCount = (int) template.getParameters().keySet().stream()
                .filter(context::isParameterNeeded)
                .count();
        log.info("Import complete: {} resources, {} parameters, {} outputs, {} blocks, {} warnings",
                template.getResources().size(), parameterCount, template.getOutputs().size(),
                context.getBlockCount(), diagnostics.getWarnings().size());

        return ImportResult.builder()
                .template(template)
                .graph(graph)
                .resourceOrder(order)
                .files(files)
                .resourceCount(template.getResources().size())
                .parameterCount(parameterCount)
                .outputCount(template.getOutputs().size())
                .blockCount(context.getBlockCount())
                .diagnostics(diagnostics)
                .build();
    }

    private void runStrictChecks(Template template, ReferenceGraph graph, ToolDiagnostics diagnostics) {
        for (List<String> cycle : CycleDetector.findCycles(graph, template.getResources().keySet())) {
            String msg = "Dependency cycle between resources: " + String.join(", ", cycle);
            log.error(msg);
            diagnostics.addError(msg);
        }
        for (DanglingReference dangling : ReferenceValidator.findDanglingReferences(template, graph)) {
            String msg = "Reference to undeclared id " + dangling.target() + " from " + dangling.source();
            log.error(msg);
            diagnostics.addError(msg);
        }
    }
}
