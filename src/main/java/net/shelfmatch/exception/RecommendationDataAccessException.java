package net.shelfmatch.exception;

/**
 * The catalog or activity store could not be read.
 * RETRYABLE: by the repository only; the recommendation pipeline never retries.
 *
 * <p>This is the only failure the recommendation core lets escape. Empty catalogs and users
 * without history are normal results, not errors.</p>
 */
public class RecommendationDataAccessException extends RuntimeException {

    private final String operation;

    public RecommendationDataAccessException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Repository operation that failed, e.g. {@code listBooks}. */
    public String getOperation() {
        return operation;
    }
}
