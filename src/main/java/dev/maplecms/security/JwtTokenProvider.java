package dev.maplecms.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS512 access tokens. Subject is the user's email; the role travels
 * in the {@code role} claim.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String ISSUER = "maple-cms";
    static final String AUDIENCE = "maple-cms-api";

    // HS512 needs a 512-bit key
    private static final int MIN_SECRET_LENGTH = 64;

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration:900000}")
    private long expiration;

    private SecretKey key;
    private JwtParser jwtParser;

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "jwt.secret must be at least %d characters for HS512, got %d",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized (HS512, ttl={}ms)", expiration);
    }

    public String generateToken(String email, String role) {
        Instant now = Instant.now();
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(email)
                .claim("role", role)
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    /**
     * Access-token lifetime in seconds, as reported to clients.
     */
    public long getExpirationSeconds() {
        return expiration / 1000;
    }

    /**
     * Outcome of verifying a token: either its claims, or why it was rejected.
     */
    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }
        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }
        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            return TokenValidationResult.success(jwtParser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            log.debug("JWT expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (JwtException e) {
            log.warn("JWT rejected: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT missing: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty token");
        }
    }

    public String getEmailFromToken(String token) {
        TokenValidationResult result = validateAndParseClaims(token);
        return result.valid() ? result.claims().getSubject() : null;
    }
}
