package com.pharmos.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.graphql.server.WebSocketGraphQlInterceptor;
import org.springframework.graphql.server.WebSocketGraphQlRequest;
import org.springframework.graphql.server.WebSocketSessionInfo;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Identity Interceptor for GraphQL requests
 *
 * Resolves the caller before any resolver runs and places the {@link Identity}
 * in the GraphQL context under {@link #IDENTITY_KEY}.
 *
 * Token sources:
 * - HTTP: "Authorization: Bearer <token>" header
 * - WebSocket: "authorization" entry of the connection_init payload, kept in the
 *   session attributes for every subscription on that connection
 *
 * A missing or unknown token never rejects the request here. The operation runs
 * without an identity and the resolvers' guards decide what that means.
 */
@Component
public class IdentityInterceptor implements WebSocketGraphQlInterceptor {

    private static final Logger log = LoggerFactory.getLogger(IdentityInterceptor.class);

    public static final String IDENTITY_KEY = "identity";

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String CONNECTION_PARAM = "authorization";
    private static final String SESSION_TOKEN_ATTRIBUTE = "pharmos.token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final IdentityResolver identityResolver;

    public IdentityInterceptor(IdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        String token = request instanceof WebSocketGraphQlRequest
            ? (String) ((WebSocketGraphQlRequest) request).getSessionInfo()
                .getAttributes().get(SESSION_TOKEN_ATTRIBUTE)
            : extractToken(request.getHeaders().getFirst(AUTHORIZATION_HEADER));

        Identity identity = identityResolver.resolve(token);
        if (identity != null) {
            log.debug("Resolved identity {} for operation {}", identity, request.getOperationName());
            request.configureExecutionInput((input, builder) ->
                builder.graphQLContext(context -> context.of(IDENTITY_KEY, identity)).build());
        } else if (token != null) {
            log.warn("Rejected token for operation {}", request.getOperationName());
        }
        return chain.next(request);
    }

    @Override
    public Mono<Object> handleConnectionInitialization(
            WebSocketSessionInfo sessionInfo, Map<String, Object> connectionInitPayload) {
        Object value = connectionInitPayload.get(CONNECTION_PARAM);
        if (value == null) {
            value = connectionInitPayload.get(AUTHORIZATION_HEADER);
        }
        String token = value != null ? extractToken(value.toString()) : null;
        if (token != null) {
            sessionInfo.getAttributes().put(SESSION_TOKEN_ATTRIBUTE, token);
        }
        log.debug("WebSocket connection {} initialized, token present={}", sessionInfo.getId(), token != null);
        return Mono.empty();
    }

    /**
     * Strip an optional "Bearer " prefix.
     *
     * @return the bare token, or null if the header is absent or blank
     */
    static String extractToken(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            return null;
        }
        String value = authorization.trim();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            value = value.substring(BEARER_PREFIX.length()).trim();
        }
        return value.isEmpty() ? null : value;
    }
}
