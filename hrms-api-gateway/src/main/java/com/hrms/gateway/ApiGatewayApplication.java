package com.hrms.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.client.discovery.EnableDiscoveryClient;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * HRMS API Gateway Application
 *
 * Single entry point for the HRMS backend services. Handles:
 * - Path-prefix routing to the employee, performance, learning,
 *   time-attendance and notification services
 * - Health-aware instance selection and per-service circuit breaking
 * - Adaptive rate limiting driven by system load
 * - Bearer-token and API-key authentication, access logging
 */
@SpringBootApplication
@EnableDiscoveryClient
@EnableScheduling
public class ApiGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiGatewayApplication.class, args);
    }
}
