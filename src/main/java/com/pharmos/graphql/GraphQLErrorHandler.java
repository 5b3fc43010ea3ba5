package com.pharmos.graphql;

import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Custom GraphQL error handler that formats exceptions into GraphQL error responses.
 *
 * The failed field resolves to null and the error is reported next to the data
 * of its siblings, so one failing branch never aborts the whole operation.
 *
 * Supported error types:
 * - UNAUTHORIZED: no identity in the request
 * - FORBIDDEN: insufficient role
 * - BAD_REQUEST: invalid mutation input or arguments
 * - INTERNAL_ERROR: failed data loader batch or unexpected server error
 */
@Component
public class GraphQLErrorHandler extends DataFetcherExceptionResolverAdapter {
    private static final Logger logger = LoggerFactory.getLogger(GraphQLErrorHandler.class);

    public static final String BATCH_FETCH_FAILURE = "BATCH_FETCH_FAILURE";

    /**
     * Resolves exceptions to GraphQL errors with appropriate error types and extensions.
     *
     * @param ex the exception thrown during data fetching
     * @param env the data fetching environment containing query context
     * @return a GraphQL error with formatted message and extensions
     */
    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        // Data loader failures arrive wrapped by the future that carried them
        if (ex instanceof CompletionException && ex.getCause() != null) {
            ex = ex.getCause();
        }

        if (ex instanceof GraphQLException) {
            return handleGraphQLException((GraphQLException) ex, env);
        }

        if (ex instanceof BatchFetchException) {
            return handleBatchFetchException((BatchFetchException) ex, env);
        }

        // Validation errors, e.g. unknown sort field
        if (ex instanceof IllegalArgumentException) {
            return handleIllegalArgumentException((IllegalArgumentException) ex, env);
        }

        if (ex instanceof NullPointerException) {
            return handleNullPointerException((NullPointerException) ex, env);
        }

        return handleGenericException(ex, env);
    }

    /**
     * Handles custom GraphQLException with its specific error type and code.
     */
    private GraphQLError handleGraphQLException(GraphQLException ex, DataFetchingEnvironment env) {
        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", ex.getErrorCode());

        return GraphqlErrorBuilder.newError(env)
                .errorType(ex.getErrorType())
                .message(formatErrorMessage(ex))
                .extensions(extensions)
                .build();
    }

    /**
     * Handles BatchFetchException by creating an INTERNAL_ERROR naming the loader.
     */
    private GraphQLError handleBatchFetchException(BatchFetchException ex, DataFetchingEnvironment env) {
        logger.error("Data loader {} failed for a batch of {} keys", ex.getLoaderName(), ex.getBatchSize(), ex);

        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", BATCH_FETCH_FAILURE);
        extensions.put("loader", ex.getLoaderName());

        if (ex.getCause() != null) {
            extensions.put("cause", ex.getCause().getClass().getSimpleName());
        }

        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.INTERNAL_ERROR)
                .message("Failed to load related data")
                .extensions(extensions)
                .build();
    }

    /**
     * Handles IllegalArgumentException by creating a BAD_REQUEST error.
     */
    private GraphQLError handleIllegalArgumentException(IllegalArgumentException ex, DataFetchingEnvironment env) {
        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", "INVALID_ARGUMENT");

        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.BAD_REQUEST)
                .message(formatErrorMessage(ex))
                .extensions(extensions)
                .build();
    }

    /**
     * Handles NullPointerException by creating an INTERNAL_ERROR.
     */
    private GraphQLError handleNullPointerException(NullPointerException ex, DataFetchingEnvironment env) {
        logger.error("Null value encountered while resolving a field", ex);

        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", "NULL_POINTER");

        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.INTERNAL_ERROR)
                .message("An unexpected null value was encountered")
                .extensions(extensions)
                .build();
    }

    /**
     * Handles generic exceptions by creating an INTERNAL_ERROR.
     */
    private GraphQLError handleGenericException(Throwable ex, DataFetchingEnvironment env) {
        logger.error("Unhandled exception while resolving a field", ex);

        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", "INTERNAL_ERROR");
        extensions.put("exceptionType", ex.getClass().getSimpleName());

        return GraphqlErrorBuilder.newError(env)
                .errorType(ErrorType.INTERNAL_ERROR)
                .message("An internal error occurred while processing your request")
                .extensions(extensions)
                .build();
    }

    /**
     * Formats error messages to be user-friendly while preserving important details.
     *
     * @param ex the exception to format
     * @return a formatted error message
     */
    private String formatErrorMessage(Throwable ex) {
        String message = ex.getMessage();

        if (message == null || message.isEmpty()) {
            return "An error occurred: " + ex.getClass().getSimpleName();
        }

        // Only the first line reaches the client
        message = message.split("\n")[0];
        message = message.replaceAll("\\sat .*", "");

        return message.trim();
    }
}
