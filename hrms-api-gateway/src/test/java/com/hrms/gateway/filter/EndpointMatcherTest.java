package com.hrms.gateway.filter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointMatcherTest {

    @Test
    void wildcardMatchesPrefixAndBelow() {
        assertThat(EndpointMatcher.matches("/actuator", "/actuator/**")).isTrue();
        assertThat(EndpointMatcher.matches("/actuator/health/liveness", "/actuator/**")).isTrue();
        assertThat(EndpointMatcher.matches("/actuatorX", "/actuator/**")).isFalse();
    }

    @Test
    void plainPatternMatchesExactOrSubPath() {
        assertThat(EndpointMatcher.matches("/health", "/health")).isTrue();
        assertThat(EndpointMatcher.matches("/health/db", "/health")).isTrue();
        assertThat(EndpointMatcher.matches("/healthz", "/health")).isFalse();
    }

    @Test
    void emptyPatternsMatchNothing() {
        assertThat(EndpointMatcher.matchesAny("/health", List.of())).isFalse();
        assertThat(EndpointMatcher.matchesAny("/health", null)).isFalse();
    }
}
