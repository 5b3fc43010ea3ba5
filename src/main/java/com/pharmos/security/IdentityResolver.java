package com.pharmos.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pharmos.domain.User;
import com.pharmos.storage.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Resolves bearer tokens to identities.
 *
 * Tokens are looked up in a fixed development table that maps each token to a
 * user id; the user record supplies email, role and permissions. Successful
 * resolutions are cached, unknown tokens are not.
 */
@Component
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private static final long CACHE_MAX_SIZE = 1000;

    static final Map<String, String> DEVELOPMENT_TOKENS = Map.of(
        "admin-token", "user_admin",
        "researcher-token", "user_researcher",
        "demo-token", "user_demo",
        "lead-token", "user_lead",
        "pm-token", "user_pm",
        "clinical-token", "user_clinical"
    );

    private final UserRepository userRepository;
    private final Cache<String, Identity> identityCache;

    public IdentityResolver(
            UserRepository userRepository,
            @Value("${pharmos.identity.cache-ttl-minutes:5}") long cacheTtlMinutes) {
        this.userRepository = userRepository;
        this.identityCache = Caffeine.newBuilder()
            .maximumSize(CACHE_MAX_SIZE)
            .expireAfterWrite(cacheTtlMinutes, TimeUnit.MINUTES)
            .build();

        log.info("IdentityResolver initialized with {} development tokens (cache TTL={}min)",
            DEVELOPMENT_TOKENS.size(), cacheTtlMinutes);
    }

    /**
     * @param token raw bearer token, without the "Bearer " prefix
     * @return the identity, or null when the token is absent, unknown or its user is inactive
     */
    public Identity resolve(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return identityCache.get(token.trim(), this::lookup);
    }

    /**
     * Drop cached resolutions, e.g. after a user's role changed.
     */
    public void invalidateAll() {
        identityCache.invalidateAll();
    }

    private Identity lookup(String token) {
        String userId = DEVELOPMENT_TOKENS.get(token);
        if (userId == null) {
            log.debug("Unknown token presented");
            return null;
        }
        User user = userRepository.findById(userId);
        if (user == null || !user.isActive()) {
            log.warn("Token maps to missing or inactive user {}", userId);
            return null;
        }
        return new Identity(user.getId(), user.getEmail(), user.getRole(), user.getPermissions());
    }
}
