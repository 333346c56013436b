package com.hrms.gateway.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * API keys accepted on credential-authenticated endpoints.
 *
 * Used by ExternalApiKeyFilter for integrations (payroll exports, HR partner
 * systems) that call the gateway with an {@code X-API-Key} header instead of
 * a bearer token.
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "hrms.gateway.external")
public class ExternalApiConfig {

    /**
     * Accepted keys. An empty list disables key authentication.
     */
    private List<String> apiKeys = new ArrayList<>();

    /**
     * Endpoints reachable with an API key. Supports patterns ending with /**
     */
    private List<String> endpoints = new ArrayList<>(List.of("/api/external/**"));
}
