package com.wetwire.importer.cli.output;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wetwire.importer.cli.model.ImportOptions;
import com.wetwire.importer.cli.model.ValidatedImportOptions;
import com.wetwire.importer.codegen.ImportResult;

/**
 * Responsible only for printing CLI output for the "import" command.
 * No validation, no execution.
 */
public class ImportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ImportResultsPrinter.class);

    public void printBanner(ImportOptions o, ValidatedImportOptions v) {
        log.info("=================================================");
        log.info("CloudFormation Template Importer");
        log.info("=================================================");
        log.info("Template: {}", v.getTemplateFile().toAbsolutePath());
        log.info("Package: {}", o.getPackageName() != null ? o.getPackageName() : "derived from file name");
        log.info("Class Name: {}", o.getClassName() != null ? o.getClassName() : "derived from file name");
        log.info("Runtime Package: {}", o.getRuntimePackage() != null ? o.getRuntimePackage() : "default");
        log.info("Catalog: {}", o.getCatalogFile() != null ? o.getCatalogFile().toAbsolutePath() : "naming convention");
        log.info("Scaffold: {}", o.isScaffold());
        log.info("Strict: {}", o.isStrict());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedImportOptions v, ImportResult result) {
        log.info("");
        log.info("=================================================");
        log.info("IMPORT SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", v.getNormalizedOutputDir());
        log.info("Resources: {}", result.getResourceCount());
        log.info("Parameters: {}", result.getParameterCount());
        log.info("Outputs: {}", result.getOutputCount());
        log.info("Property Blocks: {}", result.getBlockCount());
        log.info("");
        log.info("Files Written:");
        for (String file : result.getFiles().keySet()) {
            log.info("  {}", file);
        }
        printWarnings(result.getDiagnostics().getWarnings());
        log.info("=================================================");
    }

    public void printFailure(ImportResult result) {
        log.error("Import failed with {} error(s):", result.getDiagnostics().getErrors().size());
        for (String error : result.getDiagnostics().getErrors()) {
            log.error("  {}", error);
        }
        printWarnings(result.getDiagnostics().getWarnings());
    }

    public void printExistingFiles(List<Path> existing) {
        log.error("Output files already exist. Use --force to overwrite:");
        for (Path path : existing) {
            log.error("  {}", path);
        }
    }

    private void printWarnings(List<String> warnings) {
        if (warnings.isEmpty()) {
            return;
        }
        log.info("");
        log.warn("Warnings ({}):", warnings.size());
        for (String warning : warnings) {
            log.warn("  {}", warning);
        }
    }
}
