package com.wetwire.importer.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "import" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ImportOptions {

	@Parameters(index = "0", paramLabel = "<template>", description = "CloudFormation template file (YAML or JSON)")
	private Path templateFile;

	@Option(names = { "--output-dir", "-o" }, description = "Output directory (defaults to current directory)")
	private Path outputDir;

	@Option(names = { "--package", "-p" }, description = "Package of the generated class (derived from the file name if omitted)")
	private String packageName;

	@Option(names = { "--class-name", "-c" }, description = "Name of the generated class (derived from the file name if omitted)")
	private String className;

	@Option(names = {
			"--runtime-package" }, description = "Base package of the typed resource library (default: dev.wetwire.aws)")
	private String runtimePackage;

	@Option(names = { "--catalog" }, description = "JSON type catalog; the naming-convention catalog is used if omitted")
	private Path catalogFile;

	@Option(names = { "--scaffold" }, description = "Also generate a pom.xml and place sources under src/main/java")
	private boolean scaffold;

	@Option(names = { "--strict" }, description = "Report dependency cycles and dangling references as errors")
	private boolean strict;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing files")
	private boolean force;

}
