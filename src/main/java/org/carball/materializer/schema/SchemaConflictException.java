package org.carball.materializer.schema;

import org.carball.materializer.model.query.PropertyKey;

/**
 * A column with the derived name exists but is not the materialization we would create.
 * Needs manual review; the existing column is never touched.
 */
public class SchemaConflictException extends Exception {

    private final PropertyKey key;

    public SchemaConflictException(PropertyKey key, String message) {
        super(message);
        this.key = key;
    }

    public PropertyKey getKey() {
        return key;
    }
}
