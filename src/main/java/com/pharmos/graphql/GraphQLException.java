package com.pharmos.graphql;

import org.springframework.graphql.execution.ErrorType;

/**
 * Custom exception for GraphQL-specific errors.
 *
 * Carries the GraphQL error type and a client-facing error code that the
 * {@link GraphQLErrorHandler} copies into the error extensions.
 */
public class GraphQLException extends RuntimeException {

    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String INVALID_INPUT = "INVALID_INPUT";

    private final ErrorType errorType;
    private final String errorCode;

    /**
     * Creates a new GraphQL exception with a message and error type.
     *
     * @param message the error message
     * @param errorType the GraphQL error type
     */
    public GraphQLException(String message, ErrorType errorType) {
        super(message);
        this.errorType = errorType;
        this.errorCode = errorType.name();
    }

    /**
     * Creates a new GraphQL exception with a message, error type, and custom error code.
     *
     * @param message the error message
     * @param errorType the GraphQL error type
     * @param errorCode a custom error code for client handling
     */
    public GraphQLException(String message, ErrorType errorType, String errorCode) {
        super(message);
        this.errorType = errorType;
        this.errorCode = errorCode;
    }

    /**
     * No identity in the request context.
     */
    public static GraphQLException unauthenticated() {
        return new GraphQLException("Authentication required", ErrorType.UNAUTHORIZED, UNAUTHENTICATED);
    }

    /**
     * Identity present but its role is insufficient.
     */
    public static GraphQLException forbidden(String message) {
        return new GraphQLException(message, ErrorType.FORBIDDEN, FORBIDDEN);
    }

    /**
     * Missing or malformed mutation argument, raised before any write.
     */
    public static GraphQLException invalidInput(String message) {
        return new GraphQLException(message, ErrorType.BAD_REQUEST, INVALID_INPUT);
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
