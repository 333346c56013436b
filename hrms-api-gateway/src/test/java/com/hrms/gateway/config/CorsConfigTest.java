package com.hrms.gateway.config;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.cors.reactive.CorsWebFilter;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

class CorsConfigTest {

    private final CorsWebFilter filter =
            new CorsConfig("https://hrms.example.com, http://localhost:3000").corsWebFilter();

    private static MockServerWebExchange preflight(String origin) {
        return MockServerWebExchange.from(MockServerHttpRequest.options("/api/v1/employees")
                .header(HttpHeaders.ORIGIN, origin)
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, HttpMethod.PUT.name())
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "X-API-Key"));
    }

    @Test
    void configuredOriginIsAllowed() {
        MockServerWebExchange exchange = preflight("https://hrms.example.com");

        filter.filter(exchange, e -> Mono.empty()).block();

        HttpHeaders headers = exchange.getResponse().getHeaders();
        assertThat(headers.getAccessControlAllowOrigin()).isEqualTo("https://hrms.example.com");
        assertThat(headers.getAccessControlAllowCredentials()).isTrue();
    }

    @Test
    void unknownOriginIsRefused() {
        MockServerWebExchange exchange = preflight("https://evil.example.net");

        filter.filter(exchange, e -> Mono.empty()).block();

        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(exchange.getResponse().getHeaders().getAccessControlAllowOrigin()).isNull();
    }
}
