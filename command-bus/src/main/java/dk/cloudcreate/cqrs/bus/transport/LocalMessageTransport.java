package dk.cloudcreate.cqrs.bus.transport;

import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * In-process {@link MessageTransport}. Every message is delivered asynchronously, on the transport's own executor, to all
 * active subscriptions whose pattern matches the subject.<br>
 * Observers (see {@link #observe(String, MessageHandler)}) receive requests without the ability to reply and never count as request subscribers.<br>
 * {@link #request(String, byte[], Duration)} blocks the caller until the first subscriber responds or the timeout expires.
 */
public class LocalMessageTransport implements MessageTransport, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(LocalMessageTransport.class);

    private final    String                  name;
    private final    int                     deliveryThreads;
    private final    List<LocalSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile ExecutorService         deliveryExecutor;
    private volatile boolean                 started;

    public LocalMessageTransport() {
        this("LocalTransport", Runtime.getRuntime().availableProcessors());
    }

    public LocalMessageTransport(String name, int deliveryThreads) {
        this.name = requireNonNull(name, "No name provided");
        requireTrue(deliveryThreads >= 1, msg("deliveryThreads must be >= 1, was {}", deliveryThreads));
        this.deliveryThreads = deliveryThreads;
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting transport with {} delivery thread(s)", name, deliveryThreads);
            deliveryExecutor = Executors.newFixedThreadPool(deliveryThreads,
                                                            ThreadFactoryBuilder.builder()
                                                                                .nameFormat(name + "-Delivery-%d")
                                                                                .daemon(true)
                                                                                .build());
            started = true;
            log.info("[{}] Started transport", name);
        } else {
            log.debug("[{}] Transport was already started", name);
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping transport", name);
            started = false;
            subscriptions.forEach(LocalSubscription::unsubscribe);
            deliveryExecutor.shutdownNow();
            deliveryExecutor = null;
            log.info("[{}] Stopped transport", name);
        } else {
            log.debug("[{}] Transport was already stopped", name);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public byte[] request(String subject, byte[] data, Duration timeout) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(data, "No data provided");
        requireNonNull(timeout, "No timeout provided");
        var reply = new CompletableFuture<byte[]>();
        var matches = deliver(new Message(subject, data, Optional.of(reply::complete)));
        if (matches == 0) {
            throw new TransportException(msg("No subscribers for request subject '{}'", subject));
        }
        try {
            return reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new RequestTimeoutException(msg("Request on subject '{}' didn't receive a reply within {} ms", subject, timeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(msg("Interrupted while waiting for the reply to a request on subject '{}'", subject), e);
        } catch (ExecutionException e) {
            throw new TransportException(msg("Request on subject '{}' failed", subject), e.getCause());
        }
    }

    @Override
    public void publish(String subject, byte[] data) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(data, "No data provided");
        var matches = deliver(new Message(subject, data, Optional.empty()));
        log.trace("[{}] Published {} byte(s) on subject '{}' to {} subscriber(s)", name, data.length, subject, matches);
    }

    @Override
    public Subscription subscribe(String subjectPattern, MessageHandler handler) {
        requireNonNull(subjectPattern, "No subjectPattern provided");
        requireNonNull(handler, "No handler provided");
        var subscription = new LocalSubscription(subjectPattern, handler, false);
        subscriptions.add(subscription);
        log.debug("[{}] Subscribed to '{}'", name, subjectPattern);
        return subscription;
    }

    @Override
    public Subscription observe(String subjectPattern, MessageHandler handler) {
        requireNonNull(subjectPattern, "No subjectPattern provided");
        requireNonNull(handler, "No handler provided");
        var subscription = new LocalSubscription(subjectPattern, handler, true);
        subscriptions.add(subscription);
        log.debug("[{}] Observing '{}'", name, subjectPattern);
        return subscription;
    }

    /**
     * @return the number of matching subscriptions, observers excluded
     */
    private int deliver(Message message) {
        if (!started) {
            throw new TransportException(msg("[{}] Transport isn't started", name));
        }
        var matches         = 0;
        var observedMessage = message.isRequest() ? new Message(message.subject(), message.data(), Optional.empty()) : message;
        for (var subscription : subscriptions) {
            if (subscription.isActive() && Subjects.matches(subscription.subjectPattern, message.subject())) {
                if (!subscription.observer) {
                    matches++;
                }
                var delivered = subscription.observer ? observedMessage : message;
                try {
                    deliveryExecutor.execute(() -> subscription.onMessage(delivered));
                } catch (RejectedExecutionException e) {
                    throw new TransportException(msg("[{}] Failed to deliver message on subject '{}'", name, message.subject()), e);
                }
            }
        }
        return matches;
    }

    @Override
    public String toString() {
        return "LocalMessageTransport{" +
                "name='" + name + '\'' +
                ", subscriptions=" + subscriptions.size() +
                ", started=" + started +
                '}';
    }

    private class LocalSubscription implements Subscription {
        private final    String         subjectPattern;
        private final    MessageHandler handler;
        private final    boolean        observer;
        private volatile boolean        active = true;

        private LocalSubscription(String subjectPattern, MessageHandler handler, boolean observer) {
            this.subjectPattern = subjectPattern;
            this.handler = handler;
            this.observer = observer;
        }

        private void onMessage(Message message) {
            if (!active) {
                return;
            }
            try {
                handler.onMessage(message);
            } catch (RuntimeException e) {
                log.error(msg("[{}] Handler subscribed to '{}' failed to handle message on subject '{}'", name, subjectPattern, message.subject()), e);
            }
        }

        @Override
        public String subjectPattern() {
            return subjectPattern;
        }

        @Override
        public void unsubscribe() {
            if (active) {
                active = false;
                subscriptions.remove(this);
                log.debug("[{}] Unsubscribed from '{}'", name, subjectPattern);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
