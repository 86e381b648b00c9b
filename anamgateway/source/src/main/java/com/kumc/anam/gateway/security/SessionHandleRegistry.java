package com.kumc.anam.gateway.security;

import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.gateway.config.AnamGatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory credentials keyed by opaque session handle, used in
 * {@link CredentialMode#SESSION_HANDLE} mode.
 * <p>
 * Entries expire with the token that carries their handle. When the registry is full,
 * expired entries are purged; if it is still full, it is cleared and the affected members
 * have to log in again.
 */
@Component
@Slf4j
public class SessionHandleRegistry {

    private static final int HANDLE_BYTES = 32;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final int maxEntries;

    @Autowired
    public SessionHandleRegistry(Clock clock, AnamGatewayProperties properties) {
        this(clock, properties.getSecurity().getSessionMaxEntries());
    }

    SessionHandleRegistry(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    /**
     * Remember credentials for {@code ttl} and return the new handle.
     */
    public String register(PortalCredentials credentials, Duration ttl) {
        if (entries.size() >= maxEntries) {
            purgeExpired();
            if (entries.size() >= maxEntries) {
                log.warn("Session handle registry full ({} entries); clearing", entries.size());
                entries.clear();
            }
        }
        byte[] bytes = new byte[HANDLE_BYTES];
        random.nextBytes(bytes);
        String handle = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        entries.put(handle, new Entry(credentials, clock.millis() + ttl.toMillis()));
        return handle;
    }

    /**
     * Credentials for a handle that is known and not yet expired.
     */
    public Optional<PortalCredentials> lookup(String handle) {
        if (handle == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(handle);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs <= clock.millis()) {
            entries.remove(handle, entry);
            return Optional.empty();
        }
        return Optional.of(entry.credentials);
    }

    public int size() {
        return entries.size();
    }

    private void purgeExpired() {
        long now = clock.millis();
        entries.values().removeIf(entry -> entry.expiresAtMs <= now);
    }

    private static final class Entry {
        private final PortalCredentials credentials;
        private final long expiresAtMs;

        private Entry(PortalCredentials credentials, long expiresAtMs) {
            this.credentials = credentials;
            this.expiresAtMs = expiresAtMs;
        }
    }
}
