package dk.cloudcreate.cqrs.aggregates.serialization;

/**
 * Encoding or decoding a command or event failed
 */
public class SerializationException extends RuntimeException {
    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
