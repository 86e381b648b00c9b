package com.kumc.anam.client;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Portal member id and password. Held in memory only for the duration of a request.
 */
@Getter
@EqualsAndHashCode
public final class PortalCredentials {

    private final String identifier;
    private final String secret;

    public PortalCredentials(String identifier, String secret) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.secret = Objects.requireNonNull(secret, "secret");
    }

    @Override
    public String toString() {
        return "PortalCredentials{identifier='" + identifier + "', secret='****'}";
    }
}
