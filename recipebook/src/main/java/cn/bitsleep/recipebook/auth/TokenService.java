package cn.bitsleep.recipebook.auth;

import cn.bitsleep.recipebook.domain.Role;
import cn.bitsleep.recipebook.domain.User;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues and checks HS256 tokens. Only the most recently issued token of a user is accepted.
 */
@Service
@Slf4j
public class TokenService {
    private final SecretKey key = Keys.secretKeyFor(SignatureAlgorithm.HS256);
    private final Map<Long, String> userTokens = new ConcurrentHashMap<>();

    @Value("${recipebook.auth.token-ttl-seconds:3600}")
    private long ttlSeconds;

    public String issue(User user) {
        String jws = Jwts.builder()
                .setSubject(String.valueOf(user.getId()))
                .claim("roles", user.getRoles().stream().map(Role::authority).sorted().toList())
                .setIssuedAt(new Date())
                .setExpiration(Date.from(Instant.now().plusSeconds(ttlSeconds)))
                .signWith(key)
                .compact();
        userTokens.put(user.getId(), jws);
        return jws;
    }

    /**
     * @return the user id the token was issued to, or null when the token is invalid, expired or superseded
     */
    public Long validate(String token) {
        try {
            String sub = Jwts.parserBuilder().setSigningKey(key).build()
                    .parseClaimsJws(token).getBody().getSubject();
            Long userId = Long.valueOf(sub);
            String stored = userTokens.get(userId);
            if (stored != null && stored.equals(token)) return userId;
            return null;
        } catch (Exception e) {
            log.debug("Rejected token: {}", e.getMessage());
            return null;
        }
    }

    public void revoke(Long userId) { userTokens.remove(userId); }
}
