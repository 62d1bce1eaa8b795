package dk.cloudcreate.cqrs.aggregates.eventstore;

/**
 * The {@link EventStore} rejected a batch of events. None of the events in the batch were persisted
 */
public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
