package com.wetwire.importer.model;

import java.util.Optional;

/**
 * Argument shapes accepted by intrinsic functions.
 *
 * Each shape turns an already-normalized raw argument into the canonical
 * argument stored on an {@link Intrinsic}, or rejects it.
 */
public enum ArgumentShape {

    /** A single name: {@code !Ref Bucket}. */
    NAME {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            return raw.asString() != null ? Optional.of(raw) : Optional.empty();
        }
    },

    /** {@code "Target.Attribute"} or {@code [Target, Attribute]}; canonical form is a two-element list. */
    ATTRIBUTE_PATH {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            String text = raw.asString();
            if (text != null) {
                int dot = text.indexOf('.');
                if (dot <= 0 || dot == text.length() - 1) {
                    return Optional.empty();
                }
                return Optional.of(IrList.of(
                        IrScalar.string(text.substring(0, dot)),
                        IrScalar.string(text.substring(dot + 1))));
            }
            if (raw instanceof IrList list && list.size() >= 2
                    && list.get(0) instanceof IrScalar target && list.get(1) instanceof IrScalar attribute
                    && target.getValue() != null && attribute.getValue() != null) {
                return Optional.of(IrList.of(
                        IrScalar.string(target.asText()),
                        IrScalar.string(attribute.asText())));
            }
            return Optional.empty();
        }
    },

    /** A template string, or {@code [template, variables]}. */
    TEMPLATE {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            if (raw.asString() != null) {
                return Optional.of(raw);
            }
            if (raw instanceof IrList list && !list.isEmpty() && list.get(0).asString() != null) {
                if (list.size() == 1) {
                    return Optional.of(list.get(0));
                }
                if (list.get(1) instanceof IrMap) {
                    return Optional.of(IrList.of(list.get(0), list.get(1)));
                }
            }
            return Optional.empty();
        }
    },

    /** A positional argument list with a minimum length; extra elements beyond the maximum are dropped. */
    LIST {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            if (!(raw instanceof IrList list) || list.size() < minArgs) {
                return Optional.empty();
            }
            if (maxArgs >= 0 && list.size() > maxArgs) {
                return Optional.of(new IrList(list.getItems().subList(0, maxArgs)));
            }
            return Optional.of(list);
        }
    },

    /** A single operand, written bare or as a one-element list. */
    FIRST_OR_SELF {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            if (raw instanceof IrList list) {
                return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
            }
            return Optional.of(raw);
        }
    },

    /** An optional name; absent or empty means "current". */
    OPTIONAL_NAME {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            if (raw instanceof IrList list) {
                if (list.isEmpty()) {
                    return Optional.of(IrScalar.string(""));
                }
                return normalize(list.get(0), minArgs, maxArgs);
            }
            if (raw instanceof IrScalar scalar) {
                return Optional.of(IrScalar.string(scalar.asText()));
            }
            return Optional.of(raw);
        }
    },

    /** Any single value. */
    ANY {
        @Override
        Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs) {
            return Optional.of(raw);
        }
    };

    abstract Optional<IrValue> normalize(IrValue raw, int minArgs, int maxArgs);
}
