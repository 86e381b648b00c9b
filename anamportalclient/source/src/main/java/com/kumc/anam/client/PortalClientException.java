package com.kumc.anam.client;

/**
 * Failure talking to the portal: transport errors, non-2xx responses, unreadable bodies
 * and responses the portal itself marks as failed.
 */
public class PortalClientException extends RuntimeException {

    public PortalClientException(String message) {
        super(message);
    }

    public PortalClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
