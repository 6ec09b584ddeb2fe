package org.iceforge.governor.quota;

import java.util.Locale;

/**
 * Resources the ledger accounts for. Counts and byte sizes share one counter shape.
 */
public enum ResourceType {
    JOBS("jobs", false),
    ARTIFACTS("artifacts", true),
    CACHE_BYTES("cache-bytes", true),
    API_REQUESTS("api-requests", false);

    private final String propertyName;
    private final boolean bytes;

    ResourceType(String propertyName, boolean bytes) {
        this.propertyName = propertyName;
        this.bytes = bytes;
    }

    /** Name used in configuration keys and API payloads. */
    public String propertyName() {
        return propertyName;
    }

    public boolean isBytes() {
        return bytes;
    }

    /**
     * Accepts the property name, the enum constant, or either with '_' and '-' swapped.
     */
    public static ResourceType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("resource name is blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ResourceType t : values()) {
            if (t.propertyName.equals(normalized)) return t;
        }
        throw new IllegalArgumentException("Unknown resource: " + name);
    }
}
