package com.warden.identity;

import com.warden.identity.config.IdentityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden Identity Service. Resolves who is behind every request and serves the
 * sign-in, sign-up and access token forms.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints
 *   <li>Correlation ID propagation and identity enrichment of the logging MDC
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(IdentityProperties.class)
public class IdentityServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(IdentityServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(IdentityServiceApplication.class, args);
        log.info("Warden Identity Service started successfully");
    }
}
