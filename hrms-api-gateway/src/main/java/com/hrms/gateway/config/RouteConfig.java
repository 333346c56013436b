package com.hrms.gateway.config;

import com.hrms.gateway.routing.ServiceProxyFilter;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.cloud.gateway.route.builder.RouteLocatorBuilder;
import org.springframework.cloud.gateway.support.RouteMetadataUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Route Configuration for API Gateway
 *
 * A single catch-all route hands every request that no controller handles to
 * {@link ServiceProxyFilter}, which picks the logical service from the path
 * prefix table and the instance from the registry. The route URI is only a
 * placeholder; the proxy filter replaces the request URL.
 */
@Configuration
public class RouteConfig {

    static final String PLACEHOLDER_URI = "http://upstream.invalid";

    private final ServiceProxyFilter serviceProxyFilter;
    private final GatewayProperties properties;

    public RouteConfig(ServiceProxyFilter serviceProxyFilter, GatewayProperties properties) {
        this.serviceProxyFilter = serviceProxyFilter;
        this.properties = properties;
    }

    @Bean
    public RouteLocator customRouteLocator(RouteLocatorBuilder builder) {
        GatewayProperties.Proxy proxy = properties.getProxy();
        return builder.routes()
                .route("hrms-services", r -> r
                        .path("/**")
                        .filters(f -> f.filter(serviceProxyFilter))
                        .metadata(RouteMetadataUtils.RESPONSE_TIMEOUT_ATTR, proxy.getResponseTimeout().toMillis())
                        .metadata(RouteMetadataUtils.CONNECT_TIMEOUT_ATTR, proxy.getConnectTimeout().toMillis())
                        .uri(PLACEHOLDER_URI))
                .build();
    }
}
