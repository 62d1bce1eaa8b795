package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.bus.*;
import dk.cloudcreate.cqrs.bus.transport.*;
import dk.cloudcreate.cqrs.common.types.CorrelationId;
import org.slf4j.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Caller side rendezvous between a sent command and its asynchronously published {@link Outcome}.<br>
 * Usage:
 * <pre>{@code
 * outcomeSubscriptions.subscribe(correlationId);
 * try {
 *     // send the command
 *     var aggregateId = outcomeSubscriptions.awaitOutcome(correlationId, Duration.ofSeconds(5));
 * } finally {
 *     outcomeSubscriptions.unsubscribe(correlationId);
 * }
 * }</pre>
 * Subscribe <b>before</b> sending, otherwise the outcome may be published before anyone listens for it.
 * Each subscription holds at most one outcome.
 */
public class OutcomeSubscriptions {
    private static final Logger log = LoggerFactory.getLogger(OutcomeSubscriptions.class);

    private final MessageTransport                             transport;
    private final ConcurrentMap<CorrelationId, PendingOutcome> pendingOutcomes = new ConcurrentHashMap<>();

    public OutcomeSubscriptions(MessageTransport transport) {
        this.transport = requireNonNull(transport, "No transport provided");
    }

    /**
     * Start listening for the outcome of the command with the given correlation id
     *
     * @param correlationId the correlation id
     * @throws CommandBusException if there already is a subscription for the correlation id
     * @throws TransportException  if the transport failed to subscribe. The correlation id is then left unsubscribed
     */
    public void subscribe(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        var pending = new PendingOutcome();
        if (pendingOutcomes.putIfAbsent(correlationId, pending) != null) {
            throw new CommandBusException(msg("Already subscribed to outcomes for correlation id '{}'", correlationId));
        }
        try {
            pending.subscription = transport.subscribe(CommandChannels.outcomeSubjectPattern(correlationId),
                                                       message -> deliver(toOutcome(correlationId, message)));
        } catch (RuntimeException e) {
            // Leave no reservation behind, so the correlation id can be subscribed again
            pendingOutcomes.remove(correlationId, pending);
            throw e;
        }
        log.trace("[{}] Subscribed to outcome", correlationId);
    }

    public boolean isSubscribed(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        return pendingOutcomes.containsKey(correlationId);
    }

    /**
     * Hand an outcome to the subscription waiting for it
     *
     * @param outcome the outcome
     * @return true if a subscription accepted the outcome, false if nobody is subscribed to its correlation id
     * @throws OutcomeAlreadyDeliveredException if the subscription already holds an outcome
     */
    public boolean deliver(Outcome outcome) {
        requireNonNull(outcome, "No outcome provided");
        var pending = pendingOutcomes.get(outcome.correlationId());
        if (pending == null) {
            log.trace("[{}] Ignoring outcome without a subscription", outcome.correlationId());
            return false;
        }
        if (!pending.outcome.complete(outcome)) {
            throw new OutcomeAlreadyDeliveredException(outcome);
        }
        log.debug("[{}] Delivered {} outcome", outcome.correlationId(), outcome.isSuccess() ? "success" : "error");
        return true;
    }

    /**
     * Wait for the outcome of the command with the given correlation id
     *
     * @param correlationId the correlation id
     * @param timeout       the maximum time to wait
     * @return the aggregate id of a successful outcome
     * @throws NotSubscribedException  if {@link #subscribe(CorrelationId)} wasn't called first
     * @throws RemoteCommandException  if the command failed
     * @throws OutcomeTimeoutException if no outcome arrived within <code>timeout</code>
     */
    public String awaitOutcome(CorrelationId correlationId, Duration timeout) {
        requireNonNull(correlationId, "No correlationId provided");
        requireNonNull(timeout, "No timeout provided");
        var pending = pendingOutcomes.get(correlationId);
        if (pending == null) {
            throw new NotSubscribedException(correlationId);
        }
        Outcome outcome;
        try {
            outcome = pending.outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new OutcomeTimeoutException(correlationId, timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandBusException(msg("Interrupted while waiting for the outcome of correlation id '{}'", correlationId), e);
        } catch (ExecutionException e) {
            throw new CommandBusException(msg("Failed to receive the outcome of correlation id '{}'", correlationId), e.getCause());
        }
        if (outcome.isSuccess()) {
            return outcome.value();
        }
        throw new RemoteCommandException(correlationId, outcome.value());
    }

    /**
     * Stop listening for the outcome. Must be called on every exit path after {@link #subscribe(CorrelationId)}
     */
    public void unsubscribe(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        var pending = pendingOutcomes.remove(correlationId);
        if (pending != null && pending.subscription != null) {
            pending.subscription.unsubscribe();
            log.trace("[{}] Unsubscribed from outcome", correlationId);
        }
    }

    public int numberOfSubscriptions() {
        return pendingOutcomes.size();
    }

    private static Outcome toOutcome(CorrelationId correlationId, Message message) {
        var value = new String(message.data(), StandardCharsets.UTF_8);
        if (CommandChannels.isErrorSubject(message.subject())) {
            return Outcome.failure(correlationId, value);
        }
        return Outcome.success(correlationId, value);
    }

    private static class PendingOutcome {
        private final    CompletableFuture<Outcome> outcome = new CompletableFuture<>();
        private volatile Subscription               subscription;
    }
}
