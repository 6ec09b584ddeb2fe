package org.iceforge.governor.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Objects;

/**
 * Key layouts shared by the cache, the query path and retention.
 * <ul>
 *   <li>{@code query:<sha256>} for ad-hoc query results</li>
 *   <li>{@code table:<name>:<sha256>} for results that depend on one table, so ingestion can
 *       drop them with {@link CacheStore#invalidatePrefix(String)}</li>
 *   <li>{@code artifact:<id>:<suffix>} for values derived from a stored artifact</li>
 * </ul>
 */
public final class CacheKeys {
    private CacheKeys() {}

    public static String forQuery(String sql) {
        return "query:" + sha256Hex(normalizeSql(sql));
    }

    public static String forTable(String table, String sql) {
        return tablePrefix(table) + sha256Hex(normalizeSql(sql));
    }

    public static String tablePrefix(String table) {
        Objects.requireNonNull(table, "table");
        String t = table.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) throw new IllegalArgumentException("table is blank");
        return "table:" + t + ":";
    }

    public static String forArtifact(String artifactId, String suffix) {
        return artifactPrefix(artifactId) + (suffix == null ? "" : suffix);
    }

    public static String artifactPrefix(String artifactId) {
        Objects.requireNonNull(artifactId, "artifactId");
        return "artifact:" + artifactId + ":";
    }

    static String normalizeSql(String sql) {
        if (sql == null) return "";
        // trim + collapse whitespace
        return sql.trim().replaceAll("\\s+", " ");
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] dig = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(dig.length * 2);
            for (byte b : dig) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
