package dk.cloudcreate.cqrs.aggregates;

/**
 * Base exception for failures related to loading, handling commands on and applying events to aggregates
 */
public class AggregateException extends RuntimeException {
    public AggregateException() {
    }

    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }

    public AggregateException(Throwable cause) {
        super(cause);
    }

    public AggregateException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
