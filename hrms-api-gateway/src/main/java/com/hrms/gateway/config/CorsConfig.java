package com.hrms.gateway.config;

import com.hrms.gateway.filter.AdaptiveRateLimitFilter;
import com.hrms.gateway.filter.LoggingFilter;
import com.hrms.gateway.ratelimit.ClientKeyResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * CORS Configuration for API Gateway
 *
 * Browser clients (the HRMS web app) may call the gateway from the configured
 * origins only. Rate-limit, retry and correlation headers are exposed so the
 * frontend can back off and report request ids.
 */
@Configuration
public class CorsConfig {

    private final List<String> allowedOrigins;

    public CorsConfig(@Value("${cors.allowed-origins:http://localhost:3000}") String allowedOrigins) {
        this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    @Bean
    public CorsWebFilter corsWebFilter() {
        CorsConfiguration corsConfig = new CorsConfiguration();
        corsConfig.setAllowedOrigins(allowedOrigins);
        corsConfig.setAllowedMethods(List.of("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS"));
        corsConfig.setAllowedHeaders(List.of(
                HttpHeaders.AUTHORIZATION,
                HttpHeaders.CONTENT_TYPE,
                HttpHeaders.ACCEPT,
                ClientKeyResolver.API_KEY_HEADER,
                LoggingFilter.CORRELATION_ID_HEADER));
        corsConfig.setExposedHeaders(List.of(
                AdaptiveRateLimitFilter.LIMIT_HEADER,
                AdaptiveRateLimitFilter.REMAINING_HEADER,
                HttpHeaders.RETRY_AFTER,
                LoggingFilter.CORRELATION_ID_HEADER));
        corsConfig.setAllowCredentials(true);
        // preflight cached for an hour
        corsConfig.setMaxAge(3600L);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfig);
        return new CorsWebFilter(source);
    }
}
