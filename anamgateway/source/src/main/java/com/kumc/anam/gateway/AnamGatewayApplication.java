package com.kumc.anam.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Anam Portal Gateway
 *
 * Signs members in against the Anam hospital patient portal, issues a short-lived
 * bearer token and proxies read-only medical record queries on their behalf.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AnamGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnamGatewayApplication.class, args);
    }
}
