package com.pharmos.graphql;

import graphql.scalars.ExtendedScalars;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.execution.RuntimeWiringConfigurer;

/**
 * Configuration class for GraphQL setup.
 *
 * Registers the custom scalars declared in schema.graphqls.
 */
@Configuration
public class GraphQLConfig {

    /**
     * Configures runtime wiring for GraphQL schema.
     *
     * @return the runtime wiring configurer
     */
    @Bean
    public RuntimeWiringConfigurer runtimeWiringConfigurer() {
        return wiringBuilder -> wiringBuilder
                // ISO-8601 timestamps backed by java.time.Instant
                .scalar(DateTimeScalar.INSTANCE)
                // Passthrough structured values such as property bags
                .scalar(ExtendedScalars.Json);
    }
}
