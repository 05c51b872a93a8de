package com.wetwire.importer.codegen;

import java.util.ArrayList;
import java.util.List;

import com.wetwire.importer.codegen.context.GenerationContext;
import com.wetwire.importer.codegen.util.NamingUtil;
import com.wetwire.importer.model.Intrinsic;
import com.wetwire.importer.model.IrList;
import com.wetwire.importer.model.IrValue;

/**
 * Renders intrinsic calls through the statically imported runtime helpers.
 *
 * References to resources and parameters of the same template render as bare
 * identifiers, attribute lookups on local resources as {@code Id.Attribute};
 * everything else falls back to {@code ref(..)} and {@code getAtt(..)} calls.
 */
public class IntrinsicRenderer {

    private final GenerationContext context;
    private final ValueRenderer values;

    IntrinsicRenderer(GenerationContext context, ValueRenderer values) {
        this.context = context;
        this.values = values;
    }

    public String render(Intrinsic intrinsic, int indent) {
        String function = intrinsic.getKind().getFunctionName();
        return switch (intrinsic.getKind()) {
            case REF -> renderRef(intrinsic.getTarget(), indent);
            case GET_ATT -> renderGetAtt(intrinsic.getTarget(), intrinsic.getAttribute(), indent);
            case SUB -> renderSub(intrinsic, indent);
            case CONDITION -> helper(function, List.of(ValueRenderer.quote(intrinsic.getTarget())), indent);
            case GET_AZS -> {
                IrValue region = intrinsic.getArgs();
                if (region.asString() != null && region.asString().isEmpty()) {
                    yield helper(function, List.of(), indent);
                }
                yield helper(function, renderArgs(List.of(region), indent), indent);
            }
            default -> helper(function, renderArgs(intrinsic.argList(), indent), indent);
        };
    }

    private String renderRef(String target, int indent) {
        ReferenceResolver resolver = context.getReferenceResolver();
        return switch (resolver.classify(target)) {
            case PSEUDO_PARAMETER -> resolver.pseudoParameterConstant(target)
                    .map(constant -> {
                        context.useIntrinsics();
                        return constant;
                    })
                    .orElseGet(() -> refCall(target, indent));
            case RESOURCE -> context.memberName(target);
            case PARAMETER -> {
                context.markParameterUsed(target);
                yield context.memberName(target);
            }
            case EXTERNAL -> refCall(target, indent);
        };
    }

    private String refCall(String target, int indent) {
        return helper("ref", List.of(ValueRenderer.quote(target)), indent);
    }

    private String renderGetAtt(String target, String attribute, int indent) {
        if (context.getReferenceResolver().classify(target) == ReferenceResolver.TargetKind.RESOURCE
                && NamingUtil.isValidIdentifier(attribute)) {
            return context.memberName(target) + "." + attribute;
        }
        return helper("getAtt", List.of(ValueRenderer.quote(target), ValueRenderer.quote(attribute)), indent);
    }

    private String renderSub(Intrinsic intrinsic, int indent) {
        String template = ValueRenderer.quote(intrinsic.getSubTemplate());
        if (intrinsic.getArgs() instanceof IrList) {
            String variables = values.renderUntypedMap(intrinsic.getSubVariables(),
                    indent + ValueRenderer.CONTINUATION_INDENT);
            return helper("subWithMap", List.of(template, variables), indent);
        }
        return helper("sub", List.of(template), indent);
    }

    private List<String> renderArgs(List<IrValue> args, int indent) {
        List<String> rendered = new ArrayList<>();
        for (IrValue arg : args) {
            rendered.add(values.render(arg, indent + ValueRenderer.CONTINUATION_INDENT));
        }
        return rendered;
    }

    private String helper(String function, List<String> args, int indent) {
        context.useIntrinsics();
        return values.call(function, args, indent);
    }
}
