package dk.cloudcreate.cqrs.bus.transport;

@FunctionalInterface
public interface MessageHandler {
    void onMessage(Message message);
}
