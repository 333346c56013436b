package com.hrms.gateway.discovery;

import com.hrms.gateway.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceHealthMonitorTest {

    private ServiceRegistry registry;
    private final List<String> probedUrls = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry(MutableClock.startingAt("2024-03-01T10:00:00Z"));
        registry.setHealthPath("employee", "/api/v1/health");
        registry.register("employee", "up", "http://up:3001");
        registry.register("employee", "error", "http://error:3001");
        registry.register("employee", "down", "http://down:3001");
        registry.register("employee", "slow", "http://slow:3001");
    }

    @Test
    void probeRoundMarksEachInstance() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    probedUrls.add(request.url().toString());
                    return switch (request.url().getHost()) {
                        case "up" -> Mono.just(ClientResponse.create(HttpStatus.OK).build());
                        case "error" -> Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
                        case "slow" -> Mono.never();
                        default -> Mono.error(new ConnectException("Connection refused"));
                    };
                })
                .build();
        ServiceHealthMonitor monitor = new ServiceHealthMonitor(registry, webClient, Duration.ofMillis(200));

        StepVerifier.create(monitor.probeAll()).verifyComplete();

        assertThat(probedUrls).contains("http://up:3001/api/v1/health");
        assertThat(registry.findInstance("employee", "up").orElseThrow().healthy()).isTrue();
        assertThat(registry.findInstance("employee", "error").orElseThrow().healthy()).isFalse();
        assertThat(registry.findInstance("employee", "down").orElseThrow().healthy()).isFalse();
        assertThat(registry.findInstance("employee", "slow").orElseThrow().healthy()).isFalse();
        assertThat(registry.findInstance("employee", "down").orElseThrow().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void redirectCountsAsHealthy() {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.FOUND).build()))
                .build();
        ServiceHealthMonitor monitor = new ServiceHealthMonitor(registry, webClient, Duration.ofSeconds(1));

        StepVerifier.create(monitor.probe("employee", registry.listInstances("employee").get(0)))
                .verifyComplete();

        assertThat(registry.listInstances("employee").get(0).healthy()).isTrue();
    }
}
