package com.brainvault.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;

/**
 * JWT Token Provider for validating bearer tokens issued by the external identity provider.
 *
 * The token subject is the caller's external auth id. It becomes the authentication
 * principal and the owner key of every idea the caller touches. The optional email claim
 * is carried in the authentication details so a user profile can be created on first
 * contact.
 *
 * Security Features:
 * - HS256 signature verified against the shared secret
 * - Expiration enforced by the parser
 * - Issuer and audience checked when configured
 *
 * Token generation is kept for local tooling and tests; production tokens come from the
 * identity provider.
 *
 * @see io.jsonwebtoken.Jwts
 */
@Component
@Slf4j
public class JwtTokenProvider {

    public static final String EMAIL_CLAIM = "email";
    private static final String BEARER_PREFIX = "Bearer ";

    @Value("${jwt.secret}")
    private String jwtSecret;

    @Value("${jwt.expiration:86400000}")
    private long jwtExpirationMs;

    @Value("${jwt.issuer:}")
    private String issuer;

    @Value("${jwt.audience:}")
    private String audience;

    private SecretKey secretKey;
    private JwtParser parser;

    @PostConstruct
    public void init() {
        this.secretKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));

        JwtParserBuilder builder = Jwts.parser().verifyWith(secretKey);
        if (StringUtils.hasText(issuer)) {
            builder.requireIssuer(issuer);
        }
        if (StringUtils.hasText(audience)) {
            builder.requireAudience(audience);
        }
        this.parser = builder.build();

        log.info("Bearer token verification ready (issuer check: {}, audience check: {})",
                StringUtils.hasText(issuer), StringUtils.hasText(audience));
    }

    /**
     * Generate a signed token for the given external identity.
     *
     * @param externalAuthId the caller's external auth id (token subject)
     * @param email optional email claim
     * @return JWT token string
     */
    public String generateToken(String externalAuthId, String email) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + jwtExpirationMs);

        var builder = Jwts.builder()
                .subject(externalAuthId)
                .issuedAt(now)
                .expiration(expiryDate);
        if (email != null) {
            builder.claim(EMAIL_CLAIM, email);
        }
        if (StringUtils.hasText(issuer)) {
            builder.issuer(issuer);
        }
        if (StringUtils.hasText(audience)) {
            builder.audience().add(audience);
        }

        String token = builder.signWith(secretKey, Jwts.SIG.HS256).compact();

        log.debug("Generated JWT token for subject: {}", externalAuthId);
        return token;
    }

    /**
     * Validate token signature, expiration and required claims.
     *
     * @param token the JWT token to validate
     * @return true if token is valid and carries a subject, false otherwise
     */
    public boolean validateToken(String token) {
        try {
            if (StringUtils.hasText(parseClaims(token).getSubject())) {
                return true;
            }
            log.warn("Bearer token carries no subject");
        } catch (ExpiredJwtException ex) {
            log.debug("Bearer token expired at {}", ex.getClaims().getExpiration());
        } catch (MissingClaimException | IncorrectClaimException ex) {
            log.warn("Bearer token failed the {} check", ex.getClaimName());
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Unusable bearer token ({}): {}", ex.getClass().getSimpleName(), ex.getMessage());
        }
        return false;
    }

    /**
     * Get Authentication object from a validated token.
     *
     * Principal is the subject, details hold the email claim (may be null).
     *
     * @param token the JWT token
     * @return Authentication object for the SecurityContext
     */
    public Authentication getAuthentication(String token) {
        Claims claims = parseClaims(token);

        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
                claims.getSubject(), null, List.of(new SimpleGrantedAuthority("ROLE_USER")));

        authentication.setDetails(claims.get(EMAIL_CLAIM, String.class));
        return authentication;
    }

    /**
     * @param authorizationHeader raw Authorization header value, may be null
     * @return the token after the {@code Bearer } prefix, or null when the header is absent or uses another scheme
     */
    public String extractTokenFromHeader(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorizationHeader.substring(BEARER_PREFIX.length());
    }

    private Claims parseClaims(String token) {
        return parser.parseSignedClaims(token).getPayload();
    }
}
