package com.kumc.anam.gateway.security;

/**
 * What an access token carries to recover the member's portal credentials.
 */
public enum CredentialMode {

    /**
     * The token embeds the portal password in its {@code pwd} claim. Fully stateless, but the
     * password travels inside every bearer token until it expires.
     */
    EMBEDDED,

    /**
     * The token carries an opaque handle in its {@code sid} claim; the credentials stay in the
     * gateway's memory until the token expires. Tokens do not survive a restart.
     */
    SESSION_HANDLE
}
