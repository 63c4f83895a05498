package org.carball.materializer.model.query;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Comparator;

/**
 * Identifies a JSON property path within a table's raw properties column.
 */
public record PropertyKey(String table, String propertyPath) implements Comparable<PropertyKey> {

    private static final Comparator<PropertyKey> ORDER = Comparator
            .comparing(PropertyKey::propertyPath)
            .thenComparing(PropertyKey::table);

    public PropertyKey {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Table name is required");
        }
        if (propertyPath == null || propertyPath.isEmpty()) {
            throw new IllegalArgumentException("Property path is required");
        }
    }

    /**
     * Key used for persisted state maps.
     */
    @JsonIgnore
    public String asStateKey() {
        return table + "/" + propertyPath;
    }

    @Override
    public int compareTo(PropertyKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return table + "." + propertyPath;
    }
}
