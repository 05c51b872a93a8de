package com.wetwire.importer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Insertion-ordered map of name to IR value.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class IrMap extends IrValue {

    public static final IrMap EMPTY = new IrMap(Map.of());

    Map<String, IrValue> entries;

    public IrMap(Map<String, IrValue> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public IrValue get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Keys in lexicographic order, used wherever output must be deterministic.
     */
    public List<String> sortedKeys() {
        return List.copyOf(new TreeSet<>(entries.keySet()));
    }

    @Override
    public <R> R accept(IrValueVisitor<R> visitor) {
        return visitor.visitMap(this);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
