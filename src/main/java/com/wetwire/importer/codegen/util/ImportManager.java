package com.wetwire.importer.codegen.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Manages import statements for the generated Java class.
 *
 * Types are always referenced through {@link #reference(String)}, which
 * decides whether the simple name can be used or the qualified name is
 * needed because the simple name is already taken.
 */
public class ImportManager {

    private static final Set<String> JAVA_LANG_NAMES = Set.of(
            "Object", "String", "Integer", "Long", "Double", "Boolean", "Character", "Number",
            "Class", "Enum", "Record", "Override", "System", "Math", "Exception", "Error",
            "Thread", "Runtime", "Void", "Process", "Package", "Module", "Iterable");

    private final Set<String> imports = new TreeSet<>();
    private final Set<String> staticImports = new TreeSet<>();
    private final Map<String, String> simpleNameOwners = new HashMap<>();
    private final Set<String> reservedNames = new HashSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Marks a simple name as unavailable for imports, e.g. a declared member
     * name that would obscure an imported type.
     */
    public void reserve(String simpleName) {
        reservedNames.add(simpleName);
    }

    /**
     * Returns the name to use in source for a qualified (possibly nested) type,
     * importing its top-level class when possible.
     *
     * {@code dev.wetwire.aws.resources.s3.Bucket.VersioningConfiguration} yields
     * {@code Bucket.VersioningConfiguration} and imports {@code dev.wetwire.aws.resources.s3.Bucket}.
     */
    public String reference(String qualifiedName) {
        String[] segments = qualifiedName.split("\\.");
        int top = -1;
        for (int i = 0; i < segments.length; i++) {
            if (!segments[i].isEmpty() && Character.isUpperCase(segments[i].charAt(0))) {
                top = i;
                break;
            }
        }
        if (top < 0) {
            return qualifiedName;
        }

        String simpleName = segments[top];
        String topLevel = String.join(".", List.of(segments).subList(0, top + 1));
        String displayed = String.join(".", List.of(segments).subList(top, segments.length));

        if (reservedNames.contains(simpleName)
                || (JAVA_LANG_NAMES.contains(simpleName) && !topLevel.startsWith("java.lang."))) {
            return qualifiedName;
        }
        String owner = simpleNameOwners.get(simpleName);
        if (owner == null) {
            simpleNameOwners.put(simpleName, topLevel);
            addImport(topLevel);
            return displayed;
        }
        return owner.equals(topLevel) ? displayed : qualifiedName;
    }

    /**
     * Adds an import for a fully qualified class name.
     * Skips if in same package or java.lang.
     */
    public void addImport(String fullQualifiedName) {
        if (fullQualifiedName == null || fullQualifiedName.isEmpty()) {
            return;
        }

        // Skip java.lang
        if (fullQualifiedName.startsWith("java.lang.") && fullQualifiedName.indexOf('.', "java.lang.".length()) < 0) {
            return;
        }

        // Skip same package
        if (getPackageName(fullQualifiedName).equals(currentPackage)) {
            return;
        }

        imports.add(fullQualifiedName);
    }

    /**
     * Adds a static import such as {@code dev.wetwire.aws.intrinsics.Intrinsics.*}.
     */
    public void addStaticImport(String member) {
        staticImports.add(member);
    }

    public List<String> getImports() {
        return new ArrayList<>(imports);
    }

    public List<String> getStaticImports() {
        return new ArrayList<>(staticImports);
    }

    /**
     * Generates import statements as a string.
     */
    public String generateImports() {
        if (imports.isEmpty() && staticImports.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder();
        for (String imp : imports) {
            sb.append("import ").append(imp).append(";\n");
        }
        for (String imp : staticImports) {
            sb.append("import static ").append(imp).append(";\n");
        }
        return sb.toString();
    }

    private String getPackageName(String fullQualifiedName) {
        int lastDot = fullQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return "";
        }
        return fullQualifiedName.substring(0, lastDot);
    }
}
