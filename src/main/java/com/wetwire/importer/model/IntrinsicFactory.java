package com.wetwire.importer.model;

import java.util.Optional;

/**
 * Builds {@link Intrinsic} values from the argument table in {@link IntrinsicKind}.
 *
 * Shared by both surface syntaxes so they accept exactly the same argument shapes.
 */
public final class IntrinsicFactory {

    private IntrinsicFactory() {
        // Utility class
    }

    /**
     * Creates an intrinsic if the (already normalized) argument fits the kind's shape.
     */
    public static Optional<Intrinsic> create(IntrinsicKind kind, IrValue rawArgs) {
        IrValue raw = rawArgs == null ? IrScalar.NULL : rawArgs;
        return kind.getShape()
                .normalize(raw, kind.getMinArgs(), kind.getMaxArgs())
                .map(args -> new Intrinsic(kind, args));
    }

    public static Intrinsic ref(String target) {
        return new Intrinsic(IntrinsicKind.REF, IrScalar.string(target));
    }

    public static Intrinsic getAtt(String target, String attribute) {
        return new Intrinsic(IntrinsicKind.GET_ATT, IrList.of(IrScalar.string(target), IrScalar.string(attribute)));
    }

    public static Intrinsic sub(String template) {
        return new Intrinsic(IntrinsicKind.SUB, IrScalar.string(template));
    }
}
