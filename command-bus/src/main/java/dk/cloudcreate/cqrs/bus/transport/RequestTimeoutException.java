package dk.cloudcreate.cqrs.bus.transport;

/**
 * No reply to a {@link MessageTransport#request(String, byte[], java.time.Duration)} arrived in time
 */
public class RequestTimeoutException extends TransportException {
    public RequestTimeoutException(String message) {
        super(message);
    }
}
