package dk.cloudcreate.cqrs.bus.transport;

import java.util.Optional;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A message delivered by a {@link MessageTransport} to a {@link MessageHandler}.<br>
 * Messages sent with {@link MessageTransport#request(String, byte[], java.time.Duration)} can be answered using {@link #respond(byte[])}
 */
public final class Message {
    private final String                     subject;
    private final byte[]                     data;
    private final Optional<Consumer<byte[]>> replyTo;

    public Message(String subject, byte[] data, Optional<Consumer<byte[]>> replyTo) {
        this.subject = requireNonNull(subject, "No subject provided");
        this.data = requireNonNull(data, "No data provided");
        this.replyTo = requireNonNull(replyTo, "No replyTo provided");
    }

    public String subject() {
        return subject;
    }

    public byte[] data() {
        return data;
    }

    public boolean isRequest() {
        return replyTo.isPresent();
    }

    /**
     * Reply to a request message
     *
     * @param reply the reply data
     * @throws TransportException if the message isn't a request
     */
    public void respond(byte[] reply) {
        requireNonNull(reply, "No reply provided");
        replyTo.orElseThrow(() -> new TransportException(msg("Message on subject '{}' isn't a request and can't be responded to", subject)))
               .accept(reply);
    }

    @Override
    public String toString() {
        return "Message{" +
                "subject='" + subject + '\'' +
                ", bytes=" + data.length +
                ", request=" + isRequest() +
                '}';
    }
}
