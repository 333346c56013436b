package com.hrms.gateway.filter;

import com.hrms.gateway.exception.UnauthorizedException;
import com.hrms.gateway.security.AuthenticatedUser;
import com.hrms.gateway.security.TokenAuthenticator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class AdminAccessWebFilterTest {

    @Mock
    private TokenAuthenticator authenticator;

    @InjectMocks
    private AdminAccessWebFilter filter;

    private final AtomicBoolean passed = new AtomicBoolean();
    private final WebFilterChain chain = exchange -> {
        passed.set(true);
        return Mono.empty();
    };

    private static MockServerWebExchange adminRequest(String token) {
        return MockServerWebExchange.from(MockServerHttpRequest.post("/admin/circuit-breakers/employee/reset")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token));
    }

    @Test
    void adminPasses() {
        given(authenticator.authenticate("Bearer root"))
                .willReturn(Mono.just(new AuthenticatedUser("u-1", "root@hrms.example", "ADMIN")));

        StepVerifier.create(filter.filter(adminRequest("root"), chain)).verifyComplete();

        assertThat(passed).isTrue();
    }

    @Test
    void otherRolesAreForbidden() {
        given(authenticator.authenticate("Bearer hr"))
                .willReturn(Mono.just(new AuthenticatedUser("u-2", "hr@hrms.example", "HR_MANAGER")));

        StepVerifier.create(filter.filter(adminRequest("hr"), chain))
                .expectErrorSatisfies(e -> assertThat(((UnauthorizedException) e).isForbidden()).isTrue())
                .verify();
        assertThat(passed).isFalse();
    }

    @Test
    void healthEndpointIsOpen() {
        StepVerifier.create(filter.filter(MockServerWebExchange.from(MockServerHttpRequest.get("/health")), chain))
                .verifyComplete();

        assertThat(passed).isTrue();
        verify(authenticator, never()).authenticate(any());
    }
}
