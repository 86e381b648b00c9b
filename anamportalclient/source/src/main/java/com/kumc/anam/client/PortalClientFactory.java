package com.kumc.anam.client;

/**
 * Opens portal sessions. Credentials are passed explicitly, never through process state.
 */
@FunctionalInterface
public interface PortalClientFactory {

    PortalClient create(PortalCredentials credentials);
}
