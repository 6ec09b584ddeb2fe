package org.iceforge.governor.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.sql.ResultSetMetaData;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one SQL statement against the configured {@code DataSource} and renders the rows as NDJSON,
 * one JSON object per line keyed by column label.
 */
public class JdbcQueryEngine implements QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final String sql;

    public JdbcQueryEngine(JdbcTemplate jdbc, ObjectMapper mapper, String sql) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.sql = Objects.requireNonNull(sql, "sql");
    }

    @Override
    public ComputedValue compute(String key) {
        long started = System.nanoTime();
        byte[] ndjson = jdbc.query(sql, (ResultSetExtractor<byte[]>) rs -> {
            ResultSetMetaData md = rs.getMetaData();
            int cols = md.getColumnCount();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            int rows = 0;
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= cols; i++) {
                    row.put(md.getColumnLabel(i), rs.getObject(i));
                }
                out.writeBytes(toJson(row));
                out.write('\n');
                rows++;
            }
            log.debug("Query {} returned {} rows", key, rows);
            return out.toByteArray();
        });
        log.info("Computed {} in {} ms", key, (System.nanoTime() - started) / 1_000_000L);
        return ComputedValue.of(ndjson == null ? new byte[0] : ndjson);
    }

    private byte[] toJson(Map<String, Object> row) {
        try {
            return mapper.writeValueAsString(row).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize row: " + e.getOriginalMessage(), e);
        }
    }
}
