package com.wetwire.importer.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Utility for safe file operations with automatic directory creation.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes every generated file below the output directory.
     *
     * @param files relative path to content
     */
    public static void writeAll(Path outputDir, Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> file : files.entrySet()) {
            safeWriteString(outputDir.resolve(file.getKey()), file.getValue());
        }
    }

    /**
     * Returns the files that already exist below the output directory.
     */
    public static List<Path> existingFiles(Path outputDir, Iterable<String> relativePaths) {
        List<Path> existing = new ArrayList<>();
        for (String relative : relativePaths) {
            Path path = outputDir.resolve(relative);
            if (Files.exists(path)) {
                existing.add(path);
            }
        }
        return existing;
    }
}
