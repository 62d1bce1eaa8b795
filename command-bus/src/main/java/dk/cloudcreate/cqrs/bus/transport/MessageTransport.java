package dk.cloudcreate.cqrs.bus.transport;

import java.time.Duration;

/**
 * Subject based messaging used to send commands and publish their outcomes.<br>
 * Implementations bind this contract to a concrete broker; {@link LocalMessageTransport} is the in-process implementation.
 */
public interface MessageTransport {
    /**
     * Send a request and wait for the first reply. The request is delivered to every subscription and observer matching the subject
     *
     * @param subject the subject
     * @param data    the request data
     * @param timeout how long to wait for a reply
     * @return the reply data
     * @throws RequestTimeoutException if no reply arrived within <code>timeout</code>
     * @throws TransportException      if nobody but observers is subscribed to the subject or the request couldn't be sent
     */
    byte[] request(String subject, byte[] data, Duration timeout);

    /**
     * Publish a message to every subscription matching the subject, without waiting for it to be handled
     *
     * @param subject the subject
     * @param data    the message data
     */
    void publish(String subject, byte[] data);

    /**
     * Subscribe to all subjects matching the pattern. See {@link Subjects} for the pattern syntax
     *
     * @param subjectPattern the subject pattern
     * @param handler        the handler receiving the messages
     * @return the subscription, which must be unsubscribed when no longer needed
     */
    Subscription subscribe(String subjectPattern, MessageHandler handler);

    /**
     * Passively listen to all subjects matching the pattern. An observer receives every matching message but can't reply to it,
     * and it doesn't count as a subscriber of a request subject, so a request nobody serves still fails immediately
     *
     * @param subjectPattern the subject pattern
     * @param handler        the handler receiving the messages
     * @return the subscription, which must be unsubscribed when no longer needed
     */
    Subscription observe(String subjectPattern, MessageHandler handler);
}
