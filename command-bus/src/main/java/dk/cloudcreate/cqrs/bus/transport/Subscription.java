package dk.cloudcreate.cqrs.bus.transport;

/**
 * A registration of a {@link MessageHandler} with a {@link MessageTransport}
 */
public interface Subscription {
    /**
     * The subject pattern the subscription was created with
     */
    String subjectPattern();

    /**
     * Stop delivering messages to the handler. Calling it more than once has no effect
     */
    void unsubscribe();

    boolean isActive();
}
