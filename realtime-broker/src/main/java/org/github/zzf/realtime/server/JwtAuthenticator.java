package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.server.Authenticator;

/**
 * HS256 bearer tokens.
 * <pre>
 *   {"sub": "42", "roles": ["customer"], "iat": ..., "exp": ...}
 * </pre>
 * The user id is read from {@code userId}, {@code id} or {@code sub}; roles from the {@code roles} list or the
 * single {@code role} claim.
 */
@Slf4j
public class JwtAuthenticator implements Authenticator {

    private final SecretKey key;

    public JwtAuthenticator(String secret) {
        checkNotNull(secret, "jwt secret is required");
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        checkArgument(bytes.length >= 32, "jwt secret must be at least 256 bits");
        this.key = new SecretKeySpec(bytes, "HmacSHA256");
    }

    @Override
    public Identity authenticate(String credential) throws AuthenticationException {
        if (credential == null || credential.isBlank()) {
            throw new AuthenticationException("Authentication token is required");
        }
        Claims claims;
        try {
            claims = Jwts.parser().verifyWith(key).build().parseSignedClaims(credential).getPayload();
        } catch (ExpiredJwtException e) {
            throw new AuthenticationException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("invalid token -> {}", e.getMessage());
            throw new AuthenticationException("Invalid token", e);
        }
        String userId = userId(claims);
        if (userId == null || userId.isEmpty()) {
            throw new AuthenticationException("Token has no user id");
        }
        return new Identity(userId, roles(claims));
    }

    private static String userId(Claims claims) {
        for (String name : new String[]{"userId", "id"}) {
            Object v = claims.get(name);
            if (v != null) {
                return v.toString();
            }
        }
        return claims.getSubject();
    }

    private static List<String> roles(Claims claims) {
        List<String> roles = new ArrayList<>();
        if (claims.get("roles") instanceof Collection<?> list) {
            for (Object r : list) {
                roles.add(r.toString());
            }
        }
        Object role = claims.get("role");
        if (role != null && !roles.contains(role.toString())) {
            roles.add(role.toString());
        }
        return roles;
    }

    /**
     * issue a token for the identity, used by tooling and tests
     */
    public String createToken(Identity identity, Duration ttl) {
        Date now = new Date();
        return Jwts.builder()
                .subject(identity.userId())
                .claim("roles", identity.roles())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + ttl.toMillis()))
                .signWith(key)
                .compact();
    }

}
