package org.iceforge.governor.api;

import org.iceforge.governor.query.QueryService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Objects;

@RestController
@RequestMapping("/api")
public class QueryController {

    static final String CACHE_HEADER = "Governor-Cache";
    static final String KEY_HEADER = "Governor-Cache-Key";
    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = Objects.requireNonNull(queryService);
    }

    /**
     * Runs the query through the cache. The body is NDJSON, one row per line.
     */
    @PostMapping("/queries")
    public ResponseEntity<byte[]> query(@RequestBody QueryService.QueryRequest request) {
        QueryService.QueryResult result = queryService.run(request);
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .header(CACHE_HEADER, result.hit() ? "HIT" : "MISS")
                .header(KEY_HEADER, result.key())
                .body(result.body());
    }
}
