package com.wetwire.importer.codegen.context;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.wetwire.importer.analysis.ReferenceGraph;
import com.wetwire.importer.catalog.TypeCatalog;
import com.wetwire.importer.codegen.ReferenceResolver;
import com.wetwire.importer.codegen.util.ImportManager;
import com.wetwire.importer.codegen.util.NamingUtil;
import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.PseudoParameter;
import com.wetwire.importer.model.Template;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;

/**
 * All mutable state of one code generation run.
 *
 * A context is created per invocation and never shared, so concurrent runs
 * with separate contexts are independent.
 */
@Getter
public final class GenerationContext {

    static final String MAPPING_SUFFIX = "Mapping";
    static final String CONDITION_SUFFIX = "Condition";
    static final String OUTPUT_SUFFIX = "Output";

    private final Template template;
    private final GeneratorConfig config;
    private final TypeCatalog catalog;
    private final ReferenceGraph graph;
    private final List<String> resourceOrder;
    private final ToolDiagnostics diagnostics;
    private final ImportManager importManager;
    private final ReferenceResolver referenceResolver;

    private final Map<String, Integer> blockNameCounters = new HashMap<>();
    private final Set<String> usedNames = new HashSet<>();
    private final Map<String, String> memberNames = new HashMap<>();
    private final Map<String, String> mappingNames = new HashMap<>();
    private final Map<String, String> conditionNames = new HashMap<>();
    private final Map<String, String> outputNames = new HashMap<>();
    private final Set<String> usedParameters = new TreeSet<>();
    private int blockCount;

    /** Logical id of the resource being generated, or null outside resources. */
    @Setter
    private String currentResource;

    /** Template name of the property being generated, or null. */
    @Setter
    private String currentProperty;

    public GenerationContext(@NonNull Template template,
                             @NonNull GeneratorConfig config,
                             @NonNull TypeCatalog catalog,
                             @NonNull ReferenceGraph graph,
                             @NonNull List<String> resourceOrder,
                             @NonNull ToolDiagnostics diagnostics) {
        this.template = template;
        this.config = config;
        this.catalog = catalog;
        this.graph = graph;
        this.resourceOrder = List.copyOf(resourceOrder);
        this.diagnostics = diagnostics;
        this.importManager = new ImportManager(config.getPackageName());
        this.referenceResolver = new ReferenceResolver(template);
        registerDeclaredNames();
    }

    /**
     * Assigns every top-level member its name once. Parameters and resources
     * keep their sanitized logical id where possible; a name already taken
     * gets the first free numeric suffix.
     */
    private void registerDeclaredNames() {
        usedNames.add(config.getClassName());
        importManager.reserve(config.getClassName());
        for (PseudoParameter pseudo : PseudoParameter.values()) {
            usedNames.add(pseudo.getConstantName());
        }
        template.getParameters().keySet()
                .forEach(id -> memberNames.put(id, claimUnique(NamingUtil.sanitizeIdentifier(id))));
        template.getResources().keySet()
                .forEach(id -> memberNames.put(id, claimUnique(NamingUtil.sanitizeIdentifier(id))));
        template.getMappings().keySet()
                .forEach(id -> mappingNames.put(id, claimUnique(NamingUtil.sanitizeIdentifier(id + MAPPING_SUFFIX))));
        template.getConditions().keySet()
                .forEach(id -> conditionNames.put(id, claimUnique(NamingUtil.sanitizeIdentifier(id + CONDITION_SUFFIX))));
        template.getOutputs().keySet()
                .forEach(id -> outputNames.put(id, claimUnique(NamingUtil.sanitizeIdentifier(id + OUTPUT_SUFFIX))));
    }

    private String claimUnique(String base) {
        String name = base;
        for (int counter = 1; usedNames.contains(name); counter++) {
            name = base + counter;
        }
        register(name);
        return name;
    }

    private void register(String name) {
        usedNames.add(name);
        importManager.reserve(name);
    }

    /**
     * Member name of a resource or parameter.
     */
    public String memberName(String logicalId) {
        return memberNames.getOrDefault(logicalId, NamingUtil.sanitizeIdentifier(logicalId));
    }

    public String mappingName(String logicalId) {
        return mappingNames.getOrDefault(logicalId, NamingUtil.sanitizeIdentifier(logicalId + MAPPING_SUFFIX));
    }

    public String conditionName(String logicalId) {
        return conditionNames.getOrDefault(logicalId, NamingUtil.sanitizeIdentifier(logicalId + CONDITION_SUFFIX));
    }

    public String outputName(String logicalId) {
        return outputNames.getOrDefault(logicalId, NamingUtil.sanitizeIdentifier(logicalId + OUTPUT_SUFFIX));
    }

    /**
     * Claims a unique name for a block extracted from the current resource's
     * current property. Without a descriptive suffix, or when the derived name
     * is taken, the per-(owner, property) counter supplies one.
     */
    public String claimBlockName(String suffix) {
        String owner = memberName(currentResource);
        String name = suffix == null || suffix.isEmpty() ? owner + nextCounter() : owner + suffix;
        while (usedNames.contains(name)) {
            name = owner + (suffix == null ? "" : suffix) + nextCounter();
        }
        register(name);
        blockCount++;
        return name;
    }

    private int nextCounter() {
        return blockNameCounters.merge(currentResource + currentProperty, 1, Integer::sum);
    }

    public void markParameterUsed(String logicalId) {
        usedParameters.add(logicalId);
    }

    /**
     * Parameters to declare: referenced through a graph edge or rendered as a bare identifier.
     */
    public boolean isParameterNeeded(String logicalId) {
        return usedParameters.contains(logicalId) || graph.isReferenced(logicalId);
    }

    /**
     * Marks the intrinsic helpers as used, adding their static import.
     */
    public void useIntrinsics() {
        importManager.addStaticImport(config.getIntrinsicsPackage() + ".Intrinsics.*");
    }

    /**
     * Source name of a runtime type in the intrinsics package, e.g. Parameter or Tag.
     */
    public String runtimeType(String simpleName) {
        return importManager.reference(config.getIntrinsicsPackage() + "." + simpleName);
    }

    public String listType() {
        return importManager.reference("java.util.List");
    }

    public String mapType() {
        return importManager.reference("java.util.Map");
    }
}
