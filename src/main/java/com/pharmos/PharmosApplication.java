package com.pharmos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the PharmOS GraphQL service.
 *
 * Serves queries and mutations over HTTP at {@code /graphql} and subscriptions
 * over WebSocket at {@code /graphql-ws}, in front of pluggable entity
 * repositories and an in-process event bus.
 *
 * @author PharmOS Team
 * @version 1.0.0
 */
@SpringBootApplication
public class PharmosApplication {

    /**
     * Main entry point for the PharmOS GraphQL service.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(PharmosApplication.class, args);
    }
}
