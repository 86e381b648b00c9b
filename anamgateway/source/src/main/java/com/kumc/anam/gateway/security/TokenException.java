package com.kumc.anam.gateway.security;

/**
 * Access token could not be turned into portal credentials.
 * <p>
 * {@link #getMessage()} is the technical reason for logs; {@link #getDetail()} is the
 * fixed text returned to the caller.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getDetail();
}
