package dk.cloudcreate.cqrs.bus;

import dk.cloudcreate.cqrs.bus.transport.*;
import dk.cloudcreate.cqrs.common.Lifecycle;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Passive observer counting the commands and outcomes flowing over a {@link MessageTransport}
 */
public class MessageStatistics implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(MessageStatistics.class);

    private final    MessageTransport                  transport;
    private final    AtomicLong                        commands          = new AtomicLong();
    private final    AtomicLong                        successOutcomes   = new AtomicLong();
    private final    AtomicLong                        errorOutcomes     = new AtomicLong();
    private final    ConcurrentMap<String, AtomicLong> commandsBySubject = new ConcurrentHashMap<>();
    private final    List<Subscription>                subscriptions     = new CopyOnWriteArrayList<>();
    private volatile boolean                           started;

    public MessageStatistics(MessageTransport transport) {
        this.transport = requireNonNull(transport, "No transport provided");
    }

    @Override
    public void start() {
        if (!started) {
            subscriptions.add(transport.observe(CommandChannels.ALL_COMMANDS, this::onCommand));
            subscriptions.add(transport.observe(CommandChannels.ALL_OUTCOMES, this::onOutcome));
            started = true;
            log.info("Started message statistics");
        }
    }

    @Override
    public void stop() {
        if (started) {
            subscriptions.forEach(Subscription::unsubscribe);
            subscriptions.clear();
            started = false;
            log.info("Stopped message statistics: {}", this);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    private void onCommand(Message message) {
        commands.incrementAndGet();
        commandsBySubject.computeIfAbsent(message.subject(), subject -> new AtomicLong()).incrementAndGet();
    }

    private void onOutcome(Message message) {
        if (CommandChannels.isErrorSubject(message.subject())) {
            errorOutcomes.incrementAndGet();
        } else {
            successOutcomes.incrementAndGet();
        }
    }

    public long commands() {
        return commands.get();
    }

    public long commands(String commandSubject) {
        var count = commandsBySubject.get(requireNonNull(commandSubject, "No commandSubject provided"));
        return count != null ? count.get() : 0;
    }

    public long outcomes() {
        return successOutcomes.get() + errorOutcomes.get();
    }

    public long successOutcomes() {
        return successOutcomes.get();
    }

    public long errorOutcomes() {
        return errorOutcomes.get();
    }

    @Override
    public String toString() {
        return "MessageStatistics{" +
                "commands=" + commands.get() +
                ", successOutcomes=" + successOutcomes.get() +
                ", errorOutcomes=" + errorOutcomes.get() +
                '}';
    }
}
