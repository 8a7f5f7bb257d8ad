package org.namix.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

public class DefaultNaming implements Naming {
    private final int maxLength;

    public DefaultNaming(int maxNameLength) {
        if (maxNameLength < 16) {
            throw new IllegalArgumentException("maxNameLength must be at least 16 but was " + maxNameLength);
        }
        this.maxLength = maxNameLength;
    }

    @Override
    public String pkName(String tableName) {
        return clampWithHash("PK_" + tableName);
    }

    @Override
    public String akName(String tableName, List<String> columns) {
        return buildNameWithColumns("AK_", tableName, columns);
    }

    @Override
    public String fkName(String tableName, String principalTableName, List<String> columns) {
        return buildNameWithColumns("FK_", tableName + "_" + principalTableName, columns);
    }

    @Override
    public String ixName(String tableName, List<String> columns) {
        return buildNameWithColumns("IX_", tableName, columns);
    }

    @Override
    public String truncate(String name) {
        return name == null ? null : clampWithHash(name);
    }

    // Column order is significant for keys and indexes, so columns are joined as given.
    private String buildNameWithColumns(String prefix, String table, List<String> columns) {
        String base = prefix + table;
        if (columns != null && !columns.isEmpty()) {
            base = base + "_" + String.join("_", columns);
        }
        return clampWithHash(base);
    }

    // If the length limit is exceeded, truncate to the form: [prefix] + '_' + [hex(hash)].
    // Uses a SHA-256 based hash so that two long names sharing a prefix stay distinct.
    private String clampWithHash(String name) {
        if (name.length() <= maxLength) return name;
        String hash = computeStableHash(name);
        int keep = Math.max(1, maxLength - (hash.length() + 1)); // including the '_' separator
        return name.substring(0, keep) + "_" + hash;
    }

    /**
     * Generates a stable hash based on SHA-256.
     * Has a lower collision probability than String.hashCode().
     */
    private String computeStableHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            // Use only the first 4 bytes (8 hex characters).
            return String.format("%02x%02x%02x%02x", hash[0], hash[1], hash[2], hash[3]);
        } catch (NoSuchAlgorithmException e) {
            // Fallback: Use String.hashCode().
            return Integer.toHexString(input.hashCode());
        }
    }
}
