package com.wetwire.importer.codegen;

/**
 * Formats member declarations of the generated class.
 */
final class DeclarationWriter {

    static final int MEMBER_INDENT = 4;

    private static final String PAD = " ".repeat(MEMBER_INDENT);

    private DeclarationWriter() {
        // Utility class
    }

    static String member(String type, String name, String initializer) {
        return PAD + "public static final " + type + " " + name + " = " + initializer + ";";
    }

    /**
     * Single-line comment; line breaks in the text are folded into spaces.
     */
    static String comment(String text) {
        return PAD + "// " + text.replaceAll("\\s+", " ").trim();
    }
}
