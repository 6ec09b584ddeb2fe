package org.iceforge.governor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.governor.api.ApiQuotaInterceptor;
import org.iceforge.governor.quota.QuotaLedger;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final QuotaLedger ledger;
    private final ApiQuotaProperties props;
    private final ObjectMapper mapper;

    public WebConfig(QuotaLedger ledger, ApiQuotaProperties props, ObjectMapper mapper) {
        this.ledger = ledger;
        this.props = props;
        this.mapper = mapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiQuotaInterceptor(ledger, props, mapper)).addPathPatterns("/api/**");
    }
}
