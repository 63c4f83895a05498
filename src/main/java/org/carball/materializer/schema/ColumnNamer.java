package org.carball.materializer.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Derives materialized column names from property paths.
 * <p>
 * Paths made only of {@code [A-Za-z0-9_$]} map to {@code prefix + path}. Any other path gets its
 * disallowed characters replaced by {@code _} plus a hash suffix of the raw path, so two paths that
 * sanitize to the same text still get different names.
 */
public class ColumnNamer {

    static final int MAX_LENGTH = 63;
    private static final int HASH_LENGTH = 8;
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_$]");

    private final String prefix;

    public ColumnNamer(String prefix) {
        this.prefix = prefix;
    }

    public String columnName(String propertyPath) {
        String sanitized = DISALLOWED.matcher(propertyPath).replaceAll("_");
        String name = prefix + sanitized;

        boolean changed = !sanitized.equals(propertyPath);
        int room = MAX_LENGTH - HASH_LENGTH - 1;
        if (!changed && name.length() <= MAX_LENGTH) {
            return name;
        }
        if (name.length() > room) {
            name = name.substring(0, room);
        }
        return name + "_" + shortHash(propertyPath);
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
