package org.iceforge.governor.config;

import org.iceforge.governor.query.FacadeOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CachePropertiesTest {

    @Test
    void defaults_parseToBytes() {
        CacheProperties props = new CacheProperties();

        assertEquals(100L * 1024 * 1024, props.maxBytesValue());
        FacadeOptions options = props.toFacadeOptions();
        assertEquals(64L * 1024, options.defaultEstimateBytes());
        assertEquals(Duration.ofMinutes(5), options.defaultTtl());
        assertEquals(Duration.ofSeconds(60), options.computeTimeout());
    }

    @Test
    void maxBytes_acceptsExpressions() {
        CacheProperties props = new CacheProperties();
        props.setMaxBytes("64*1024*1024");
        assertEquals(64L * 1024 * 1024, props.maxBytesValue());

        props.setMaxBytes("lots");
        assertThrows(IllegalArgumentException.class, props::maxBytesValue);
    }
}
