package com.pharmos.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.graphql.server.WebSocketSessionInfo;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityInterceptorTest {

    @Mock
    private IdentityResolver identityResolver;

    @Mock
    private WebSocketSessionInfo sessionInfo;

    private IdentityInterceptor interceptor;
    private Map<String, Object> sessionAttributes;

    @BeforeEach
    void setUp() {
        interceptor = new IdentityInterceptor(identityResolver);
        sessionAttributes = new HashMap<>();
    }

    @Test
    void testExtractToken() {
        assertThat(IdentityInterceptor.extractToken("Bearer admin-token")).isEqualTo("admin-token");
        assertThat(IdentityInterceptor.extractToken("bearer   lead-token ")).isEqualTo("lead-token");
        assertThat(IdentityInterceptor.extractToken("demo-token")).isEqualTo("demo-token");
        assertThat(IdentityInterceptor.extractToken("Bearer ")).isNull();
        assertThat(IdentityInterceptor.extractToken("")).isNull();
        assertThat(IdentityInterceptor.extractToken(null)).isNull();
    }

    @Test
    void testConnectionInit_StoresTokenForTheSession() {
        when(sessionInfo.getAttributes()).thenReturn(sessionAttributes);
        Map<String, Object> payload = new HashMap<>();
        payload.put("authorization", "Bearer researcher-token");

        StepVerifier.create(interceptor.handleConnectionInitialization(sessionInfo, payload))
            .verifyComplete();

        assertThat(sessionAttributes).containsValue("researcher-token");
        verifyNoInteractions(identityResolver);
    }

    @Test
    void testConnectionInit_WithoutToken() {
        StepVerifier.create(interceptor.handleConnectionInitialization(sessionInfo, new HashMap<>()))
            .verifyComplete();

        verify(sessionInfo, never()).getAttributes();
    }
}
