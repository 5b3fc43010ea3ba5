package com.pharmos.graphql;

/**
 * Thrown when the repository call behind one data loader batch fails.
 * Every key of that batch fails with this exception; other batches are unaffected.
 */
public class BatchFetchException extends RuntimeException {

    private final String loaderName;
    private final int batchSize;

    public BatchFetchException(String loaderName, int batchSize, Throwable cause) {
        super("Batch fetch failed for loader " + loaderName, cause);
        this.loaderName = loaderName;
        this.batchSize = batchSize;
    }

    public String getLoaderName() {
        return loaderName;
    }

    public int getBatchSize() {
        return batchSize;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        sb.append(" [Keys: ").append(batchSize).append("]");
        if (getCause() != null && getCause().getMessage() != null) {
            sb.append(" [Cause: ").append(getCause().getMessage()).append("]");
        }
        return sb.toString();
    }
}
