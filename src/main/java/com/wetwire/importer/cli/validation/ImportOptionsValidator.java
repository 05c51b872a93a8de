package com.wetwire.importer.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.wetwire.importer.cli.exception.OptionsValidationException;
import com.wetwire.importer.cli.model.ImportOptions;
import com.wetwire.importer.cli.model.ValidatedImportOptions;
import com.wetwire.importer.codegen.util.NamingUtil;

public class ImportOptionsValidator {

	public ValidatedImportOptions validate(ImportOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getTemplateFile() == null) {
			errors.add("Template file is required.");
		} else if (!Files.isRegularFile(o.getTemplateFile())) {
			errors.add("Template file does not exist or is not a file: " + o.getTemplateFile());
		}

		if (o.getCatalogFile() != null && !Files.isRegularFile(o.getCatalogFile())) {
			errors.add("Catalog file does not exist or is not a file: " + o.getCatalogFile());
		}

		if (!isBlank(o.getPackageName()) && !isQualifiedName(o.getPackageName())) {
			errors.add("Package name is not a valid Java package: " + o.getPackageName());
		}
		if (!isBlank(o.getClassName()) && !NamingUtil.isValidIdentifier(o.getClassName())) {
			errors.add("Class name is not a valid Java identifier: " + o.getClassName());
		}
		if (!isBlank(o.getRuntimePackage()) && !isQualifiedName(o.getRuntimePackage())) {
			errors.add("Runtime package is not a valid Java package: " + o.getRuntimePackage());
		}

		Path normalizedOutputDir = (o.getOutputDir() == null ? Path.of(".") : o.getOutputDir()).toAbsolutePath()
				.normalize();
		if (Files.exists(normalizedOutputDir) && !Files.isDirectory(normalizedOutputDir)) {
			errors.add("Output path exists and is not a directory: " + normalizedOutputDir);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException("import", errors);
		}

		Path fileName = o.getTemplateFile().getFileName();
		String sourceName = fileName == null ? o.getTemplateFile().toString() : fileName.toString();
		return new ValidatedImportOptions(o.getTemplateFile(), normalizedOutputDir, sourceName);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static boolean isQualifiedName(String name) {
		if (name.startsWith(".") || name.endsWith(".")) {
			return false;
		}
		for (String part : name.split("\\.")) {
			if (!NamingUtil.isValidIdentifier(part)) {
				return false;
			}
		}
		return true;
	}
}
