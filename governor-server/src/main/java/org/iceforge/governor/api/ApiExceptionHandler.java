package org.iceforge.governor.api;

import org.iceforge.governor.cache.EntryTooLargeException;
import org.iceforge.governor.query.ComputeFailureException;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.QuotaExceededException;
import org.iceforge.governor.registry.DuplicateRecordException;
import org.iceforge.governor.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<Map<String, Object>> quotaExceeded(QuotaExceededException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(decisionBody(e.decision()));
    }

    @ExceptionHandler(ComputeFailureException.class)
    public ResponseEntity<Map<String, Object>> computeFailed(ComputeFailureException e) {
        log.warn("Compute failed for key={}: {}", e.key(), e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "compute_failed", e.getMessage());
    }

    @ExceptionHandler(EntryTooLargeException.class)
    public ResponseEntity<Map<String, Object>> tooLarge(EntryTooLargeException e) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "entry_too_large", e.getMessage());
    }

    @ExceptionHandler(DuplicateRecordException.class)
    public ResponseEntity<Map<String, Object>> duplicate(DuplicateRecordException e) {
        return error(HttpStatus.CONFLICT, "duplicate", e.getMessage());
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<Map<String, Object>> registry(RegistryException e) {
        log.warn("Registry failure: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "registry_unavailable", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    static Map<String, Object> decisionBody(QuotaDecision d) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "quota_exceeded");
        body.put("message", d.reason());
        body.put("tenantId", d.tenantId());
        body.put("resource", d.resource().propertyName());
        body.put("requested", d.requested());
        body.put("current", d.current());
        body.put("limit", d.limit());
        return body;
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
