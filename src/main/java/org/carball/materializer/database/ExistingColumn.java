package org.carball.materializer.database;

/**
 * A column as reported by the database's catalog.
 *
 * @param defaultKind       {@code MATERIALIZED}, {@code DEFAULT}, {@code ALIAS} or empty for plain columns
 * @param defaultExpression the expression the column is computed from, empty for plain columns
 */
public record ExistingColumn(String name, String type, String defaultKind, String defaultExpression) {

    public boolean isMaterialized() {
        return "MATERIALIZED".equalsIgnoreCase(defaultKind);
    }
}
