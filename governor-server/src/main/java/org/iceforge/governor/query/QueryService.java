package org.iceforge.governor.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.governor.cache.CacheKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Objects;

/**
 * Serves SQL results through the governed cache.
 */
@Service
public class QueryService {
    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final CacheFacade facade;
    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;

    public QueryService(CacheFacade facade, JdbcTemplate jdbc, ObjectMapper mapper) {
        this.facade = Objects.requireNonNull(facade);
        this.jdbc = Objects.requireNonNull(jdbc);
        this.mapper = Objects.requireNonNull(mapper);
    }

    public record QueryRequest(String tenantId, String sql, String table, Long ttlSeconds) {}

    public record QueryResult(String key, boolean hit, byte[] body) {}

    public QueryResult run(QueryRequest req) {
        if (req == null || req.tenantId() == null || req.tenantId().isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        if (req.sql() == null || req.sql().isBlank()) {
            throw new IllegalArgumentException("sql is required");
        }
        if (req.ttlSeconds() != null && req.ttlSeconds() <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive: " + req.ttlSeconds());
        }
        String key = req.table() == null || req.table().isBlank()
                ? CacheKeys.forQuery(req.sql())
                : CacheKeys.forTable(req.table(), req.sql());
        Duration ttl = req.ttlSeconds() == null ? null : Duration.ofSeconds(req.ttlSeconds());

        boolean hit = facade.store().containsKey(key);
        byte[] body = facade.getOrCompute(key, ttl, req.tenantId(), new JdbcQueryEngine(jdbc, mapper, req.sql()));
        logger.debug("Query for tenant={} key={} hit={} bytes={}", req.tenantId(), key, hit, body.length);
        return new QueryResult(key, hit, body);
    }
}
