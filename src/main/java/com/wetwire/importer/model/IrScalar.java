package com.wetwire.importer.model;

import java.math.BigDecimal;
import java.math.BigInteger;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Literal scalar: null, String, Long, Double or Boolean.
 *
 * Integral numbers are always held as Long and fractional numbers as Double,
 * so the same literal decoded from YAML or JSON compares equal.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class IrScalar extends IrValue {

    public static final IrScalar NULL = new IrScalar(null);

    Object value;

    private IrScalar(Object value) {
        this.value = value;
    }

    public static IrScalar of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof String || raw instanceof Boolean || raw instanceof Long || raw instanceof Double) {
            return new IrScalar(raw);
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return new IrScalar(((Number) raw).longValue());
        }
        if (raw instanceof BigInteger big) {
            if (big.bitLength() < 64) {
                return new IrScalar(big.longValue());
            }
            return new IrScalar(big.toString());
        }
        if (raw instanceof Float || raw instanceof BigDecimal) {
            return new IrScalar(((Number) raw).doubleValue());
        }
        return new IrScalar(raw.toString());
    }

    public static IrScalar string(String value) {
        return value == null ? NULL : new IrScalar(value);
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Long || value instanceof Double;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    /**
     * Text form used for names and identifiers: numbers print without a fraction when whole.
     */
    public String asText() {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }

    @Override
    public <R> R accept(IrValueVisitor<R> visitor) {
        return visitor.visitScalar(this);
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
