package org.iceforge.governor.query;

import java.util.Objects;

/**
 * A computed result and the size it is accounted at.
 */
public record ComputedValue(byte[] value, long sizeBytes) {

    public ComputedValue {
        Objects.requireNonNull(value, "value");
        if (sizeBytes < 0) throw new IllegalArgumentException("sizeBytes must be >= 0: " + sizeBytes);
    }

    public static ComputedValue of(byte[] value) {
        return new ComputedValue(value, value.length);
    }
}
