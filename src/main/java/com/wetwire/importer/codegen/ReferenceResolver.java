package com.wetwire.importer.codegen;

import java.util.Optional;

import com.wetwire.importer.model.PseudoParameter;
import com.wetwire.importer.model.Template;

/**
 * Classifies reference targets against the fully parsed template, once per reference.
 */
public class ReferenceResolver {

    public enum TargetKind {
        /** Reserved {@code AWS::} name. */
        PSEUDO_PARAMETER,
        /** Resource declared in this template. */
        RESOURCE,
        /** Parameter declared in this template. */
        PARAMETER,
        /** Anything else: other stacks, typos, undeclared ids. */
        EXTERNAL
    }

    private final Template template;

    public ReferenceResolver(Template template) {
        this.template = template;
    }

    public TargetKind classify(String target) {
        if (PseudoParameter.isReserved(target)) {
            return TargetKind.PSEUDO_PARAMETER;
        }
        if (template.hasResource(target)) {
            return TargetKind.RESOURCE;
        }
        if (template.hasParameter(target)) {
            return TargetKind.PARAMETER;
        }
        return TargetKind.EXTERNAL;
    }

    /**
     * Constant name for a known pseudo-parameter, e.g. AWS_REGION.
     */
    public Optional<String> pseudoParameterConstant(String name) {
        return PseudoParameter.fromTemplateName(name).map(PseudoParameter::getConstantName);
    }
}
