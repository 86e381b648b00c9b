package com.kumc.anam.gateway.security;

import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.gateway.config.AnamGatewayProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.RequiredTypeException;
import io.jsonwebtoken.security.MacAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and decodes the gateway's access tokens (HMAC-signed JWTs).
 * <p>
 * A token is valid only while its signature verifies and its expiry has not passed.
 * There is no revocation: a token stays valid for its whole lifetime.
 */
@Service
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String SECRET_CLAIM = "pwd";
    static final String SESSION_CLAIM = "sid";

    private final SecretKey key;
    private final MacAlgorithm algorithm;
    private final Duration ttl;
    private final CredentialMode credentialMode;
    private final Clock clock;
    private final SessionHandleRegistry sessionHandles;
    private final JwtParser parser;

    public TokenService(AnamGatewayProperties properties, Clock clock, SessionHandleRegistry sessionHandles) {
        AnamGatewayProperties.Security security = properties.getSecurity();
        this.algorithm = resolveAlgorithm(security.getAlgorithm());
        this.key = resolveKey(security.getSecretKey(), algorithm);
        this.ttl = Duration.ofMinutes(security.getAccessTokenExpireMinutes());
        this.credentialMode = security.getCredentialMode();
        this.clock = clock;
        this.sessionHandles = sessionHandles;
        this.parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();

        log.info("Token service ready: algorithm={}, ttl={}, credentialMode={}",
                algorithm.getId(), ttl, credentialMode);
    }

    /**
     * Package credentials into a signed token expiring after the configured TTL.
     * Does not check the credentials against the portal.
     */
    public String issue(PortalCredentials credentials) {
        Instant now = clock.instant();
        var builder = Jwts.builder()
                .subject(credentials.getIdentifier())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)));

        if (credentialMode == CredentialMode.SESSION_HANDLE) {
            builder.claim(SESSION_CLAIM, sessionHandles.register(credentials, ttl));
        } else {
            builder.claim(SECRET_CLAIM, credentials.getSecret());
        }
        return builder.signWith(key, algorithm).compact();
    }

    /**
     * Verify a token and recover the credentials it stands for.
     *
     * @throws InvalidTokenException bad signature, malformed, expired, other algorithm or unknown handle
     * @throws MissingClaimException verified token without member id or credential claim
     */
    public PortalCredentials decode(String token) {
        Claims claims = parse(token);

        String identifier = claims.getSubject();
        if (identifier == null || identifier.isEmpty()) {
            throw new MissingClaimException("sub");
        }

        if (credentialMode == CredentialMode.SESSION_HANDLE) {
            String handle = stringClaim(claims, SESSION_CLAIM);
            PortalCredentials credentials = sessionHandles.lookup(handle)
                    .orElseThrow(() -> new InvalidTokenException("Unknown or expired session handle"));
            if (!credentials.getIdentifier().equals(identifier)) {
                throw new InvalidTokenException("Session handle does not belong to token subject");
            }
            return credentials;
        }
        return new PortalCredentials(identifier, stringClaim(claims, SECRET_CLAIM));
    }

    public Duration getTtl() {
        return ttl;
    }

    private Claims parse(String token) {
        try {
            Jws<Claims> jws = parser.parseSignedClaims(token);
            if (!algorithm.getId().equals(jws.getHeader().getAlgorithm())) {
                throw new InvalidTokenException("Unexpected token algorithm: " + jws.getHeader().getAlgorithm());
            }
            return jws.getPayload();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Token rejected: " + e.getMessage(), e);
        }
    }

    private static String stringClaim(Claims claims, String name) {
        String value;
        try {
            value = claims.get(name, String.class);
        } catch (RequiredTypeException e) {
            value = null;
        }
        if (value == null) {
            throw new MissingClaimException(name);
        }
        return value;
    }

    private static MacAlgorithm resolveAlgorithm(String name) {
        if (name == null) {
            return Jwts.SIG.HS256;
        }
        switch (name.toUpperCase()) {
            case "HS256":
                return Jwts.SIG.HS256;
            case "HS384":
                return Jwts.SIG.HS384;
            case "HS512":
                return Jwts.SIG.HS512;
            default:
                throw new IllegalStateException("Unsupported token algorithm: " + name);
        }
    }

    private static SecretKey resolveKey(String secretKey, MacAlgorithm algorithm) {
        if (secretKey == null || secretKey.isBlank()) {
            throw new IllegalStateException("anam.security.secret-key is not configured; set SECRET_KEY");
        }
        byte[] bytes = secretKey.getBytes(StandardCharsets.UTF_8);
        if (bytes.length * 8 < algorithm.getKeyBitLength()) {
            throw new IllegalStateException(String.format(
                    "anam.security.secret-key is too short for %s: %d bits, need %d",
                    algorithm.getId(), bytes.length * 8, algorithm.getKeyBitLength()));
        }
        return new SecretKeySpec(bytes, "HmacSHA" + algorithm.getId().substring(2));
    }
}
