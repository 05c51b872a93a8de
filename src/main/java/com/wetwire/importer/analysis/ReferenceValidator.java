package com.wetwire.importer.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import com.wetwire.importer.model.Template;

/**
 * Optional pass reporting references to ids the template does not declare.
 */
public final class ReferenceValidator {

    private ReferenceValidator() {
        // Utility class
    }

    public static List<DanglingReference> findDanglingReferences(Template template, ReferenceGraph graph) {
        List<DanglingReference> dangling = new ArrayList<>();
        graph.getEdges().forEach((source, targets) -> collect(template, source, targets, dangling));
        graph.getOutputEdges().forEach((source, targets) -> collect(template, source, targets, dangling));
        Collections.sort(dangling);
        return dangling;
    }

    private static void collect(Template template, String source, Set<String> targets, List<DanglingReference> sink) {
        for (String target : targets) {
            if (!template.isDeclared(target)) {
                sink.add(new DanglingReference(source, target));
            }
        }
    }
}
