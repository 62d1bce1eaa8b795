package dk.cloudcreate.cqrs.bus.transport;

import dk.cloudcreate.cqrs.bus.CommandBusException;

public class TransportException extends CommandBusException {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
