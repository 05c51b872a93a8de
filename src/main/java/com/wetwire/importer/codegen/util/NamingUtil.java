package com.wetwire.importer.codegen.util;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

import javax.lang.model.SourceVersion;

/**
 * Utility for consistent Java naming conventions.
 */
public class NamingUtil {

    private static final int MAX_SUFFIX_LENGTH = 20;

    private NamingUtil() {
        // Utility class
    }

    /**
     * Converts my-stack or my_stack to MyStack; the rest of each word keeps its case.
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        return Arrays.stream(name.split("[-_.\\s]+"))
                .map(NamingUtil::capitalize)
                .collect(Collectors.joining(""));
    }

    /**
     * Converts a template property name to its builder method name:
     * BucketName to bucketName, VPCId to vpcId, SSESpecification to sseSpecification.
     * Java keywords get a trailing underscore.
     */
    public static String toSetterName(String propertyName) {
        if (propertyName == null || propertyName.isEmpty()) {
            return propertyName;
        }
        int upper = 0;
        while (upper < propertyName.length() && Character.isUpperCase(propertyName.charAt(upper))) {
            upper++;
        }
        String result;
        if (upper == 0) {
            result = propertyName;
        } else if (upper == 1 || upper == propertyName.length()) {
            result = propertyName.substring(0, upper).toLowerCase(Locale.ROOT) + propertyName.substring(upper);
        } else {
            // Acronym prefix: keep the last capital, it starts the next word
            result = propertyName.substring(0, upper - 1).toLowerCase(Locale.ROOT) + propertyName.substring(upper - 1);
        }
        return escapeKeyword(result);
    }

    /**
     * Turns a logical id into a valid Java identifier.
     */
    public static String sanitizeIdentifier(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (sb.length() == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c)) {
                sb.append(c);
            } else if (sb.length() == 0 && Character.isJavaIdentifierPart(c)) {
                sb.append('_').append(c);
            }
        }
        if (sb.length() == 0) {
            return "_unnamed";
        }
        return escapeKeyword(sb.toString());
    }

    public static boolean isValidIdentifier(String name) {
        return name != null && SourceVersion.isIdentifier(name) && !SourceVersion.isKeyword(name);
    }

    public static String escapeKeyword(String name) {
        return SourceVersion.isKeyword(name) ? name + "_" : name;
    }

    /**
     * Singular form of a plural property name: Policies to Policy,
     * Addresses to Address, Origins to Origin; Address stays Address.
     */
    public static String singular(String name) {
        if (name == null) {
            return null;
        }
        if (name.endsWith("ies")) {
            return name.substring(0, name.length() - 3) + "y";
        }
        if (name.endsWith("sses")) {
            return name.substring(0, name.length() - 2);
        }
        if (name.endsWith("s") && !name.endsWith("ss")) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }

    /**
     * Cleans a value for use inside a declaration name: keeps letters and
     * digits, capitalizes, caps the length.
     */
    public static String cleanForName(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c) && c < 128) {
                sb.append(c);
            }
        }
        String cleaned = sb.toString();
        if (cleaned.isEmpty()) {
            return cleaned;
        }
        cleaned = Character.toUpperCase(cleaned.charAt(0)) + cleaned.substring(1);
        return cleaned.length() > MAX_SUFFIX_LENGTH ? cleaned.substring(0, MAX_SUFFIX_LENGTH) : cleaned;
    }

    /**
     * Class name for a template file: my-stack.yaml becomes MyStack.
     */
    public static String deriveClassName(String sourceName) {
        String pascal = toPascalCase(baseName(sourceName).replaceAll("[^A-Za-z0-9]+", "_"));
        if (pascal == null || pascal.isEmpty()) {
            return "ImportedStack";
        }
        if (Character.isDigit(pascal.charAt(0))) {
            pascal = "Stack" + pascal;
        }
        return escapeKeyword(pascal);
    }

    /**
     * Package name for a template file: my-stack.yaml becomes my_stack.
     */
    public static String derivePackageName(String sourceName) {
        String name = baseName(sourceName).toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        name = name.replaceAll("^_+|_+$", "");
        if (name.isEmpty()) {
            return "imported";
        }
        if (Character.isDigit(name.charAt(0))) {
            name = "stack_" + name;
        }
        return escapeKeyword(name);
    }

    private static String baseName(String sourceName) {
        if (sourceName == null) {
            return "";
        }
        String name = sourceName.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String capitalize(String str) {
        if (str.isEmpty()) return str;
        return str.substring(0, 1).toUpperCase(Locale.ROOT) + str.substring(1);
    }
}
