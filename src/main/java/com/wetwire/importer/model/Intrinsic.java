package com.wetwire.importer.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * A parsed intrinsic function call.
 *
 * The shape of {@link #args} depends on the kind:
 * <ul>
 *   <li>REF, CONDITION: string scalar</li>
 *   <li>GET_ATT: list [target, attribute]</li>
 *   <li>SUB: string scalar, or list [template, variables map]</li>
 *   <li>GET_AZS: string scalar (empty for the current region) or a nested value</li>
 *   <li>NOT, BASE64, IMPORT_VALUE, TRANSFORM: any single value</li>
 *   <li>all others: positional argument list</li>
 * </ul>
 * Instances are created through {@link IntrinsicFactory}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class Intrinsic extends IrValue {

    @NonNull
    IntrinsicKind kind;

    @NonNull
    IrValue args;

    Intrinsic(IntrinsicKind kind, IrValue args) {
        this.kind = kind;
        this.args = args;
    }

    /**
     * Target name of a REF or CONDITION, or the target id of a GET_ATT.
     */
    public String getTarget() {
        if (kind == IntrinsicKind.GET_ATT) {
            return ((IrList) args).get(0).asString();
        }
        return args.asString();
    }

    /**
     * Attribute name of a GET_ATT, e.g. "Arn".
     */
    public String getAttribute() {
        if (kind != IntrinsicKind.GET_ATT) {
            return null;
        }
        return ((IrList) args).get(1).asString();
    }

    /**
     * Template string of a SUB.
     */
    public String getSubTemplate() {
        if (kind != IntrinsicKind.SUB) {
            return null;
        }
        if (args instanceof IrList list) {
            return list.get(0).asString();
        }
        return args.asString();
    }

    /**
     * Variable map of a SUB in its two-argument form, otherwise an empty map.
     */
    public IrMap getSubVariables() {
        if (kind == IntrinsicKind.SUB && args instanceof IrList list && list.get(1) instanceof IrMap vars) {
            return vars;
        }
        return IrMap.EMPTY;
    }

    /**
     * Arguments as a positional list; single-valued kinds yield a one-element list.
     */
    public List<IrValue> argList() {
        if (args instanceof IrList list) {
            return list.getItems();
        }
        return List.of(args);
    }

    @Override
    public <R> R accept(IrValueVisitor<R> visitor) {
        return visitor.visitIntrinsic(this);
    }

    @Override
    public String toString() {
        return "!" + kind.getTagName() + " " + args;
    }
}
