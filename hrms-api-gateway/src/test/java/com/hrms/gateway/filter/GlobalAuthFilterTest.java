package com.hrms.gateway.filter;

import com.hrms.gateway.config.GatewayProperties;
import com.hrms.gateway.exception.UnauthorizedException;
import com.hrms.gateway.ratelimit.ClientKeyResolver;
import com.hrms.gateway.security.AuthenticatedUser;
import com.hrms.gateway.security.TokenAuthenticator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GlobalAuthFilterTest {

    @Mock
    private TokenAuthenticator authenticator;

    private GlobalAuthFilter filter;
    private final AtomicReference<ServerWebExchange> forwarded = new AtomicReference<>();
    private final GatewayFilterChain chain = exchange -> {
        forwarded.set(exchange);
        return Mono.empty();
    };

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getSecurity().setPublicEndpoints(List.of("/api/v1/auth/login", "/api/v1/public/**"));
        properties.getSecurity().setAdminEndpoints(List.of("/api/v1/admin/**"));
        filter = new GlobalAuthFilter(authenticator, properties);
    }

    @Test
    @DisplayName("Public endpoints pass without a token and spoofed identity headers are dropped")
    void publicEndpointStripsSpoofedHeaders() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/auth/login")
                .header(GlobalAuthFilter.USER_ID_HEADER, "admin")
                .header(GlobalAuthFilter.USER_ROLE_HEADER, "ADMIN"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        HttpHeaders headers = forwarded.get().getRequest().getHeaders();
        assertThat(headers.containsKey(GlobalAuthFilter.USER_ID_HEADER)).isFalse();
        assertThat(headers.containsKey(GlobalAuthFilter.USER_ROLE_HEADER)).isFalse();
        verify(authenticator, never()).authenticate(any());
    }

    @Test
    void authenticatedRequestCarriesIdentityDownstream() {
        given(authenticator.authenticate("Bearer good"))
                .willReturn(Mono.just(new AuthenticatedUser("u-42", "jane@hrms.example", "MANAGER")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/employees")
                .header(HttpHeaders.AUTHORIZATION, "Bearer good")
                .header(GlobalAuthFilter.USER_ROLE_HEADER, "ADMIN"));

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        HttpHeaders headers = forwarded.get().getRequest().getHeaders();
        assertThat(headers.getFirst(GlobalAuthFilter.USER_ID_HEADER)).isEqualTo("u-42");
        assertThat(headers.getFirst(GlobalAuthFilter.USER_EMAIL_HEADER)).isEqualTo("jane@hrms.example");
        assertThat(headers.get(GlobalAuthFilter.USER_ROLE_HEADER)).containsExactly("MANAGER");
        assertThat((String) exchange.getAttribute(ClientKeyResolver.IDENTITY_ATTR)).isEqualTo("u-42");
    }

    @Test
    void invalidTokenIsRejected() {
        given(authenticator.authenticate(null))
                .willReturn(Mono.error(new UnauthorizedException("Missing or invalid Authorization header")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/employees"));

        StepVerifier.create(filter.filter(exchange, chain))
                .expectError(UnauthorizedException.class)
                .verify();
        assertThat(forwarded.get()).isNull();
    }

    @Test
    void adminEndpointRequiresAdminRole() {
        given(authenticator.authenticate("Bearer employee"))
                .willReturn(Mono.just(new AuthenticatedUser("u-7", "joe@hrms.example", "EMPLOYEE")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/admin/users")
                .header(HttpHeaders.AUTHORIZATION, "Bearer employee"));

        StepVerifier.create(filter.filter(exchange, chain))
                .expectErrorSatisfies(e -> assertThat(((UnauthorizedException) e).isForbidden()).isTrue())
                .verify();
    }

    @Test
    void apiKeyAuthenticatedRequestSkipsTokenCheck() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/external/employees"));
        exchange.getAttributes().put(ExternalApiKeyFilter.API_KEY_AUTHENTICATED_ATTR, Boolean.TRUE);

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(forwarded.get()).isNotNull();
        verify(authenticator, never()).authenticate(any());
    }

    @Test
    @DisplayName("A client-sent header cannot stand in for API key authentication")
    void apiKeyFlagCannotBeSpoofedByHeader() {
        given(authenticator.authenticate(null))
                .willReturn(Mono.error(new UnauthorizedException("Missing or invalid Authorization header")));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/external/employees")
                .header(ExternalApiKeyFilter.API_KEY_AUTHENTICATED_ATTR, "true"));

        StepVerifier.create(filter.filter(exchange, chain))
                .expectError(UnauthorizedException.class)
                .verify();
    }
}
