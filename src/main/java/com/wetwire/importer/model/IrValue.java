package com.wetwire.importer.model;

/**
 * Base class for all values in the template IR.
 *
 * A value is one of: a literal scalar, an ordered list, an ordered map,
 * or an intrinsic function call. The set of subclasses is closed.
 */
public abstract class IrValue {

    IrValue() {
        // Closed hierarchy: subclasses live in this package
    }

    public abstract <R> R accept(IrValueVisitor<R> visitor);

    public boolean isScalar() {
        return this instanceof IrScalar;
    }

    public boolean isNull() {
        return this instanceof IrScalar scalar && scalar.getValue() == null;
    }

    /**
     * Returns the string content if this is a string scalar, otherwise null.
     */
    public String asString() {
        if (this instanceof IrScalar scalar && scalar.getValue() instanceof String s) {
            return s;
        }
        return null;
    }
}
