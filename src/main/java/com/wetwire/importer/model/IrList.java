package com.wetwire.importer.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Ordered list of IR values.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class IrList extends IrValue {

    public static final IrList EMPTY = new IrList(List.of());

    List<IrValue> items;

    public IrList(List<IrValue> items) {
        this.items = List.copyOf(items);
    }

    public static IrList of(IrValue... items) {
        return new IrList(List.of(items));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public IrValue get(int index) {
        return items.get(index);
    }

    @Override
    public <R> R accept(IrValueVisitor<R> visitor) {
        return visitor.visitList(this);
    }

    @Override
    public String toString() {
        return items.toString();
    }
}
