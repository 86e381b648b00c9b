package com.kumc.anam.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kumc.anam.client.PortalClientFactory;
import com.kumc.anam.client.http.PortalClientSettings;
import com.kumc.anam.client.http.RestPortalClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the portal client and the clock used for token expiry.
 */
@Configuration
@Slf4j
public class PortalClientConfig {

    @Bean
    @ConfigurationProperties(prefix = "anam.portal.client")
    public PortalClientSettings portalClientSettings() {
        return new PortalClientSettings();
    }

    @Bean
    public PortalClientFactory portalClientFactory(PortalClientSettings settings, ObjectMapper objectMapper) {
        log.info("Portal client configured: baseUrl={}, connectTimeout={}, readTimeout={}",
                settings.getBaseUrl(), settings.getConnectTimeout(), settings.getReadTimeout());
        return new RestPortalClientFactory(settings, objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
