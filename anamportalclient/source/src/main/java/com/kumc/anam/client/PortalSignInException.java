package com.kumc.anam.client;

/**
 * The portal refused the member id / password.
 */
public class PortalSignInException extends PortalClientException {

    public PortalSignInException(String message) {
        super(message);
    }

    public PortalSignInException(String message, Throwable cause) {
        super(message, cause);
    }
}
