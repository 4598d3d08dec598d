package com.arbor.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Arbor hierarchy service: tenant-scoped organizational trees over REST.
 *
 * <p>Configured by default with graceful shutdown, Actuator health and Prometheus endpoints,
 * correlation ID propagation and RFC 7807 error responses.
 */
@SpringBootApplication
public class HierarchyServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HierarchyServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HierarchyServiceApplication.class, args);
        log.info("Arbor hierarchy service started");
    }
}
