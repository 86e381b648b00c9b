package com.kumc.anam.gateway.security;

import com.kumc.anam.client.PortalCredentials;
import com.kumc.anam.gateway.config.AnamGatewayProperties;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

    private static final String KEY = "test-signing-key-that-is-long-enough-for-hs256";
    private static final Instant NOW = Instant.parse("2024-03-01T09:00:00Z");

    private AnamGatewayProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new AnamGatewayProperties();
        properties.getSecurity().setSecretKey(KEY);
        properties.getSecurity().setAccessTokenExpireMinutes(60);
        clock = new MutableClock(NOW);
    }

    @ParameterizedTest
    @CsvSource({
            "u1, p1",
            "patient@example.com, 'p@ss w0rd!'",
            "a, b",
            "member_0001, '~!#$%^&*()_+{}|:<>?'"
    })
    void decode_recoversIssuedCredentials(String identifier, String secret) {
        TokenService service = newService();

        String token = service.issue(new PortalCredentials(identifier, secret));
        PortalCredentials decoded = service.decode(token);

        assertThat(decoded.getIdentifier()).isEqualTo(identifier);
        assertThat(decoded.getSecret()).isEqualTo(secret);
    }

    @Test
    void issue_setsExpiryFromConfiguredTtl() {
        TokenService service = newService();

        String token = service.issue(new PortalCredentials("u1", "p1"));
        Date expiration = Jwts.parser().verifyWith(key()).clock(() -> Date.from(NOW)).build()
                .parseSignedClaims(token).getPayload().getExpiration();

        assertThat(expiration.toInstant()).isEqualTo(NOW.plus(Duration.ofMinutes(60)));
    }

    @Test
    void decode_stillValidJustBeforeExpiry() {
        TokenService service = newService();
        String token = service.issue(new PortalCredentials("u1", "p1"));

        clock.advance(Duration.ofMinutes(59));

        assertThat(service.decode(token).getIdentifier()).isEqualTo("u1");
    }

    @Test
    void decode_expiredToken_throwsInvalidToken() {
        TokenService service = newService();
        String token = service.issue(new PortalCredentials("u1", "p1"));

        clock.advance(Duration.ofMinutes(61));

        assertThatThrownBy(() -> service.decode(token))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessage("Token expired");
    }

    @Test
    void decode_tamperedSignature_throwsInvalidToken() {
        TokenService service = newService();
        String token = service.issue(new PortalCredentials("u1", "p1"));
        String tampered = token.substring(0, token.length() - 2)
                + (token.endsWith("AA") ? "BB" : "AA");

        assertThatThrownBy(() -> service.decode(tampered))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void decode_tokenSignedWithOtherKey_throwsInvalidToken() {
        properties.getSecurity().setSecretKey("another-signing-key-that-is-also-long-enough");
        String foreign = newService().issue(new PortalCredentials("u1", "p1"));
        properties.getSecurity().setSecretKey(KEY);

        assertThatThrownBy(() -> newService().decode(foreign))
                .isInstanceOf(InvalidTokenException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not-a-jwt", "a.b.c"})
    void decode_malformedToken_throwsInvalidToken(String token) {
        TokenService service = newService();

        assertThatThrownBy(() -> service.decode(token))
                .isInstanceOf(InvalidTokenException.class)
                .extracting(e -> ((TokenException) e).getDetail())
                .isEqualTo(InvalidTokenException.DETAIL);
    }

    @Test
    void decode_tokenWithoutSecretClaim_throwsMissingClaim() {
        String token = Jwts.builder()
                .subject("u1")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(key(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> newService().decode(token))
                .isInstanceOf(MissingClaimException.class)
                .hasMessageContaining("pwd")
                .extracting(e -> ((TokenException) e).getDetail())
                .isEqualTo(MissingClaimException.DETAIL);
    }

    @Test
    void decode_tokenWithoutSubject_throwsMissingClaim() {
        String token = Jwts.builder()
                .claim(TokenService.SECRET_CLAIM, "p1")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(key(), Jwts.SIG.HS256)
                .compact();

        assertThatThrownBy(() -> newService().decode(token))
                .isInstanceOf(MissingClaimException.class)
                .hasMessageContaining("sub");
    }

    @Test
    void decode_tokenSignedWithOtherAlgorithm_throwsInvalidToken() {
        String longKey = KEY + KEY;
        properties.getSecurity().setSecretKey(longKey);
        String token = Jwts.builder()
                .subject("u1")
                .claim(TokenService.SECRET_CLAIM, "p1")
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(new SecretKeySpec(longKey.getBytes(StandardCharsets.UTF_8), "HmacSHA384"), Jwts.SIG.HS384)
                .compact();

        assertThatThrownBy(() -> newService().decode(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void constructor_rejectsShortKey() {
        properties.getSecurity().setSecretKey("short");

        assertThatThrownBy(this::newService)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("too short");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = "   ")
    void constructor_rejectsMissingKey(String key) {
        properties.getSecurity().setSecretKey(key);

        assertThatThrownBy(this::newService)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not configured");
    }

    @Test
    void constructor_rejectsUnknownAlgorithm() {
        properties.getSecurity().setAlgorithm("RS256");

        assertThatThrownBy(this::newService)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RS256");
    }

    @Nested
    class SessionHandleMode {

        private SessionHandleRegistry registry;

        @BeforeEach
        void useSessionHandles() {
            properties.getSecurity().setCredentialMode(CredentialMode.SESSION_HANDLE);
            registry = new SessionHandleRegistry(clock, 100);
        }

        @Test
        void tokenCarriesHandleInsteadOfSecret() {
            TokenService service = new TokenService(properties, clock, registry);

            String token = service.issue(new PortalCredentials("u1", "p1"));
            var claims = Jwts.parser().verifyWith(key()).clock(() -> Date.from(NOW)).build()
                    .parseSignedClaims(token).getPayload();

            assertThat(claims).doesNotContainKey(TokenService.SECRET_CLAIM);
            assertThat(claims.get(TokenService.SESSION_CLAIM, String.class)).isNotBlank();
            assertThat(service.decode(token)).isEqualTo(new PortalCredentials("u1", "p1"));
        }

        @Test
        void unknownHandle_throwsInvalidToken() {
            TokenService service = new TokenService(properties, clock, registry);
            String token = Jwts.builder()
                    .subject("u1")
                    .claim(TokenService.SESSION_CLAIM, "forged-handle")
                    .expiration(Date.from(NOW.plusSeconds(600)))
                    .signWith(key(), Jwts.SIG.HS256)
                    .compact();

            assertThatThrownBy(() -> service.decode(token))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        void embeddedToken_isMissingHandleClaim() {
            properties.getSecurity().setCredentialMode(CredentialMode.EMBEDDED);
            String embedded = new TokenService(properties, clock, registry).issue(new PortalCredentials("u1", "p1"));
            properties.getSecurity().setCredentialMode(CredentialMode.SESSION_HANDLE);

            assertThatThrownBy(() -> new TokenService(properties, clock, registry).decode(embedded))
                    .isInstanceOf(MissingClaimException.class)
                    .hasMessageContaining(TokenService.SESSION_CLAIM);
        }
    }

    private TokenService newService() {
        return new TokenService(properties, clock, new SessionHandleRegistry(clock, 100));
    }

    private static SecretKeySpec key() {
        return new SecretKeySpec(KEY.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
    }

    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public java.time.ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
