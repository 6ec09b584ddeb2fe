package org.iceforge.governor;

import org.iceforge.governor.config.ApiQuotaProperties;
import org.iceforge.governor.config.CacheProperties;
import org.iceforge.governor.config.PruneProperties;
import org.iceforge.governor.config.QuotaProperties;
import org.iceforge.governor.config.RegistryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({CacheProperties.class, QuotaProperties.class, PruneProperties.class,
        RegistryProperties.class, ApiQuotaProperties.class})
public class GovernorApplication {

	public static void main(String[] args) {
		SpringApplication.run(GovernorApplication.class, args);
	}
}
