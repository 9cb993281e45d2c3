package dev.ecodata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the evidence-grounded extraction service.
 *
 * <p>Serves the REST API and the MCP SSE endpoint on port 8080.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class EcoDataApplication {
    public static void main(String[] args) {
        SpringApplication.run(EcoDataApplication.class, args);
    }
}
