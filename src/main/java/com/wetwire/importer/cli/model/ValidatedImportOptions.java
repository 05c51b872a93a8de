package com.wetwire.importer.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ImportCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedImportOptions {
    Path templateFile;
    Path normalizedOutputDir;
    String sourceName;
}
