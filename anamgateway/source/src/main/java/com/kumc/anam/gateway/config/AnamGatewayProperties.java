package com.kumc.anam.gateway.config;

import com.kumc.anam.gateway.security.CredentialMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gateway settings, bound once at startup from the {@code anam.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "anam")
public class AnamGatewayProperties {

    private String appName = "KUMC Anam Medical Portal";

    private String appVersion = "0.1.0";

    private Security security = new Security();

    private Portal portal = new Portal();

    @Data
    public static class Security {

        /**
         * HMAC key for signing access tokens. Must be at least as long as the algorithm requires.
         */
        private String secretKey;

        /**
         * HS256, HS384 or HS512.
         */
        private String algorithm = "HS256";

        private long accessTokenExpireMinutes = 60;

        private CredentialMode credentialMode = CredentialMode.EMBEDDED;

        /**
         * Upper bound on remembered session handles in {@link CredentialMode#SESSION_HANDLE} mode.
         */
        private int sessionMaxEntries = 10_000;
    }

    @Data
    public static class Portal {

        /**
         * Hospital code sent when a query does not name one. AA is Anam.
         */
        private String defaultHospitalCode = "AA";
    }
}
