package org.iceforge.governor.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iceforge.governor.config.ApiQuotaProperties;
import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.QuotaLedger;
import org.iceforge.governor.quota.ResourceType;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Objects;

/**
 * Charges one {@link ResourceType#API_REQUESTS} unit to the tenant named in the tenant header.
 * Requests without the header are not metered.
 */
public class ApiQuotaInterceptor implements HandlerInterceptor {

    private final QuotaLedger ledger;
    private final ApiQuotaProperties props;
    private final ObjectMapper mapper;

    public ApiQuotaInterceptor(QuotaLedger ledger, ApiQuotaProperties props, ObjectMapper mapper) {
        this.ledger = Objects.requireNonNull(ledger);
        this.props = Objects.requireNonNull(props);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) throws Exception {
        if (!props.isEnabled()) return true;
        String tenant = request.getHeader(props.getTenantHeader());
        if (tenant == null || tenant.isBlank()) return true;

        QuotaDecision decision = ledger.reserve(tenant.trim(), ResourceType.API_REQUESTS, 1);
        if (decision.allowed()) return true;

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        mapper.writeValue(response.getOutputStream(), ApiExceptionHandler.decisionBody(decision));
        return false;
    }
}
