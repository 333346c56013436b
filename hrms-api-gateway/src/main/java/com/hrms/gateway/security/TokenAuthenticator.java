package com.hrms.gateway.security;

import com.hrms.gateway.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Bearer token validation: signature and expiry through jjwt, revocation
 * through {@code revoked:<token>} keys in Redis. Redis being unreachable is
 * treated as "not revoked".
 */
@Slf4j
@Component
public class TokenAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ROLE_CLAIM = "role";
    private static final String USER_ID_CLAIM = "userId";
    private static final String EMAIL_CLAIM = "email";
    private static final String TOKEN_REVOKED_KEY_PREFIX = "revoked:";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final SecretKey signingKey;

    public TokenAuthenticator(ReactiveStringRedisTemplate redisTemplate,
                              @Value("${jwt.secret}") String jwtSecret) {
        this.redisTemplate = redisTemplate;
        this.signingKey = Keys.hmacShaKeyFor(jwtSecret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Authenticates the value of an {@code Authorization} header.
     * Fails with {@link UnauthorizedException}.
     */
    public Mono<AuthenticatedUser> authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            return Mono.error(new UnauthorizedException("Missing or invalid Authorization header"));
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length());

        AuthenticatedUser user;
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            // user ids may be issued as numbers
            Object userId = claims.get(USER_ID_CLAIM);
            user = new AuthenticatedUser(
                    userId != null ? String.valueOf(userId) : claims.getSubject(),
                    claims.get(EMAIL_CLAIM, String.class),
                    claims.get(ROLE_CLAIM, String.class));
        } catch (ExpiredJwtException e) {
            log.warn("Expired token for subject {}", e.getClaims().getSubject());
            return Mono.error(new UnauthorizedException("Token has expired"));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Token validation failed: {}", e.getMessage());
            return Mono.error(new UnauthorizedException("Invalid token"));
        }

        return isRevoked(token).flatMap(revoked -> revoked
                ? Mono.error(new UnauthorizedException("Token has been revoked"))
                : Mono.just(user));
    }

    private Mono<Boolean> isRevoked(String token) {
        return redisTemplate.hasKey(TOKEN_REVOKED_KEY_PREFIX + token)
                .defaultIfEmpty(false)
                .onErrorResume(e -> {
                    log.warn("Token revocation check unavailable, continuing: {}", e.getMessage());
                    return Mono.just(false);
                });
    }
}
