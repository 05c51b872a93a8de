package com.wetwire.importer.codegen.context;

import com.wetwire.importer.codegen.util.NamingUtil;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one import run.
 *
 * Blank package and class names are derived from the template file name.
 */
@Data
@Builder(toBuilder = true)
public class GeneratorConfig {

    public static final String DEFAULT_RUNTIME_PACKAGE = "dev.wetwire.aws";

    /**
     * Package of the generated class, e.g. {@code my_stack}.
     */
    private String packageName;

    /**
     * Simple name of the generated class, e.g. {@code MyStack}.
     */
    private String className;

    /**
     * Base package of the typed resource library the generated code compiles against.
     */
    @Builder.Default
    private String runtimePackage = DEFAULT_RUNTIME_PACKAGE;

    /**
     * Whether to also emit a pom.xml and place sources under src/main/java.
     */
    private boolean scaffold;

    /**
     * Whether to run cycle detection and reference validation and report findings as errors.
     */
    private boolean strict;

    /**
     * Returns a copy with blank names filled in from the template file name.
     */
    public GeneratorConfig resolveFor(String sourceName) {
        GeneratorConfigBuilder resolved = toBuilder();
        if (packageName == null || packageName.isBlank()) {
            resolved.packageName(NamingUtil.derivePackageName(sourceName));
        }
        if (className == null || className.isBlank()) {
            resolved.className(NamingUtil.deriveClassName(sourceName));
        }
        if (runtimePackage == null || runtimePackage.isBlank()) {
            resolved.runtimePackage(DEFAULT_RUNTIME_PACKAGE);
        }
        return resolved.build();
    }

    /**
     * Package holding the intrinsic helpers and shared types of the runtime.
     */
    public String getIntrinsicsPackage() {
        return runtimePackage + ".intrinsics";
    }
}
