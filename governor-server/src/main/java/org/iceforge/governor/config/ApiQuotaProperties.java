package org.iceforge.governor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-tenant request metering on the REST API.
 */
@ConfigurationProperties(prefix = "governor.api-quota")
public class ApiQuotaProperties {

    /** Charge one api-requests unit per call. */
    private boolean enabled = false;

    /** Header naming the calling tenant. Requests without it are not metered. */
    private String tenantHeader = "X-Tenant-Id";

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getTenantHeader() { return tenantHeader; }
    public void setTenantHeader(String tenantHeader) { this.tenantHeader = tenantHeader; }
}
