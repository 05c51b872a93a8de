package com.wetwire.importer.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.catalog.CatalogLoadException;
import com.wetwire.importer.catalog.JsonTypeCatalog;
import com.wetwire.importer.catalog.TypeCatalog;
import com.wetwire.importer.cli.exception.OptionsValidationException;
import com.wetwire.importer.cli.model.ImportOptions;
import com.wetwire.importer.cli.model.ValidatedImportOptions;
import com.wetwire.importer.cli.output.ImportResultsPrinter;
import com.wetwire.importer.cli.validation.ImportOptionsValidator;
import com.wetwire.importer.codegen.ImportResult;
import com.wetwire.importer.codegen.TemplateImporter;
import com.wetwire.importer.codegen.context.GeneratorConfig;
import com.wetwire.importer.codegen.util.FileWriteUtil;
import com.wetwire.importer.parser.TemplateParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that imports one CloudFormation template into Java source.
 */
@Command(
        name = "import",
        mixinStandardHelpOptions = true,
        description = "Converts a CloudFormation template (YAML or JSON) into a Java class of resource declarations."
)
public class ImportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    @Mixin
    private ImportOptions options;

    private final ImportOptionsValidator validator = new ImportOptionsValidator();
    private final ImportResultsPrinter printer = new ImportResultsPrinter();

    @Override
    public Integer call() {
        ValidatedImportOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.error("Invalid options for '{}':", e.getCommandName());
            e.getErrors().forEach(error -> log.error("  - {}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            GeneratorConfig config = GeneratorConfig.builder()
                    .packageName(options.getPackageName())
                    .className(options.getClassName())
                    .runtimePackage(options.getRuntimePackage())
                    .scaffold(options.isScaffold())
                    .strict(options.isStrict())
                    .build();

            TemplateImporter importer = options.getCatalogFile() != null
                    ? new TemplateImporter(config, loadCatalog())
                    : new TemplateImporter(config);
            byte[] content = Files.readAllBytes(validated.getTemplateFile());
            ImportResult result = importer.importTemplate(content, validated.getSourceName());

            if (result.hasErrors()) {
                printer.printFailure(result);
                return 1;
            }

            Path outputDir = validated.getNormalizedOutputDir();
            List<Path> existing = FileWriteUtil.existingFiles(outputDir, result.getFiles().keySet());
            if (!existing.isEmpty()) {
                if (!options.isForce()) {
                    printer.printExistingFiles(existing);
                    return 1;
                }
                log.warn("Force mode enabled, will overwrite {} file(s)", existing.size());
            }

            FileWriteUtil.writeAll(outputDir, result.getFiles());
            printer.printSuccess(validated, result);
            return 0;

        } catch (TemplateParseException | CatalogLoadException e) {
            log.error(e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Import failed with I/O error", e);
            return 1;
        }
    }

    private TypeCatalog loadCatalog() {
        JsonTypeCatalog catalog = JsonTypeCatalog.load(options.getCatalogFile());
        log.info("Loaded {} resource types from {}", catalog.size(), options.getCatalogFile());
        return catalog;
    }
}
