package com.wetwire.importer.codegen;

import java.util.List;
import java.util.SortedMap;

import com.wetwire.importer.analysis.ReferenceGraph;
import com.wetwire.importer.diagnostics.ToolDiagnostics;
import com.wetwire.importer.model.Template;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one import run.
 */
@Value
@Builder
public class ImportResult {
    Template template;
    ReferenceGraph graph;
    List<String> resourceOrder;

    /** Relative file path to generated content. */
    SortedMap<String, String> files;

    int resourceCount;
    int parameterCount;
    int outputCount;
    int blockCount;

    ToolDiagnostics diagnostics;

    public boolean hasErrors() {
        return diagnostics.hasErrors();
    }
}
