package dk.cloudcreate.cqrs.bus;

import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.aggregates.serialization.*;
import dk.cloudcreate.cqrs.bus.transport.*;
import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.common.types.*;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Receives commands for one or more aggregate types from a {@link MessageTransport} and executes them with a {@link CommandHandler}.
 * <p>
 * Every command request is answered immediately with a {@link CommandReply}: <code>error:</code> when the command can't be decoded,
 * otherwise <code>ok:ack</code>. The command is then handled on the dispatcher's executor and the outcome is published to
 * {@link CommandChannels#successSubject(CorrelationId)} (payload: the aggregate id) or
 * {@link CommandChannels#errorSubject(CorrelationId)} (payload: the error message).
 * <p>
 * Commands targeting the same aggregate are not serialized, concurrent commands may race each other.
 */
public class CommandDispatcher implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final String INTERNAL_ERROR_MESSAGE = "internal error";

    private final    MessageTransport      transport;
    private final    SerializationRegistry serializationRegistry;
    private final    CommandHandler        commandHandler;
    private final    Set<AggregateType>    aggregateTypes;
    private final    int                   handlerThreads;
    private final    List<Subscription>    subscriptions = new CopyOnWriteArrayList<>();
    private volatile ExecutorService       handlerExecutor;
    private volatile boolean               started;

    public CommandDispatcher(MessageTransport transport,
                             SerializationRegistry serializationRegistry,
                             CommandHandler commandHandler,
                             Collection<AggregateType> aggregateTypes) {
        this(transport, serializationRegistry, commandHandler, aggregateTypes, Runtime.getRuntime().availableProcessors());
    }

    public CommandDispatcher(MessageTransport transport,
                             SerializationRegistry serializationRegistry,
                             CommandHandler commandHandler,
                             Collection<AggregateType> aggregateTypes,
                             int handlerThreads) {
        this.transport = requireNonNull(transport, "No transport provided");
        this.serializationRegistry = requireNonNull(serializationRegistry, "No serializationRegistry provided");
        this.commandHandler = requireNonNull(commandHandler, "No commandHandler provided");
        requireNonNull(aggregateTypes, "No aggregateTypes provided");
        requireTrue(!aggregateTypes.isEmpty(), "You must specify at least one aggregate type");
        requireTrue(handlerThreads >= 1, "You must specify a number of handlerThreads >= 1");
        this.aggregateTypes = Set.copyOf(aggregateTypes);
        this.handlerThreads = handlerThreads;
    }

    @Override
    public void start() {
        if (!started) {
            log.info("Starting command dispatcher for aggregate types {}", aggregateTypes);
            handlerExecutor = Executors.newFixedThreadPool(handlerThreads,
                                                           ThreadFactoryBuilder.builder()
                                                                               .nameFormat("CommandDispatcher-%d")
                                                                               .daemon(true)
                                                                               .build());
            aggregateTypes.forEach(aggregateType -> subscriptions.add(transport.subscribe(CommandChannels.commandSubject(aggregateType),
                                                                                          this::onCommandMessage)));
            started = true;
            log.info("Started command dispatcher");
        } else {
            log.debug("Command dispatcher was already started");
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("Stopping command dispatcher");
            started = false;
            subscriptions.forEach(Subscription::unsubscribe);
            subscriptions.clear();
            handlerExecutor.shutdown();
            try {
                if (!handlerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Command handlers didn't complete within 5 seconds, interrupting them");
                    handlerExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handlerExecutor.shutdownNow();
            }
            handlerExecutor = null;
            log.info("Stopped command dispatcher");
        } else {
            log.debug("Command dispatcher was already stopped");
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    private void onCommandMessage(Message message) {
        Command<?> command;
        try {
            command = serializationRegistry.unmarshalCommand(message.data());
        } catch (SerializationException e) {
            log.warn("Rejecting command received on '{}': {}", message.subject(), e.getMessage());
            reply(message, CommandReply.error(e.getMessage()));
            return;
        }

        if (!aggregateTypes.contains(command.aggregateType())) {
            reply(message, CommandReply.error(msg("Aggregate type '{}' isn't served on '{}'", command.aggregateType(), message.subject())));
            return;
        }

        var executor = handlerExecutor;
        try {
            if (executor == null) {
                throw new RejectedExecutionException("No handler executor");
            }
            executor.execute(() -> handle(command));
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Rejecting command '{}', the dispatcher is stopped", command.correlationId(), command.commandId());
            reply(message, CommandReply.error("Command dispatcher is stopped"));
            return;
        }
        reply(message, CommandReply.ack());
    }

    private void handle(Command<?> command) {
        var correlationId = command.correlationId();
        try {
            var handledCommand = commandHandler.handle(command);
            publish(CommandChannels.successSubject(correlationId), handledCommand.aggregateId());
        } catch (AggregateInvariantViolationException e) {
            log.error(msg("[{}] Internal error while handling command '{}'", correlationId, command.commandId()), e);
            publish(CommandChannels.errorSubject(correlationId), INTERNAL_ERROR_MESSAGE);
        } catch (RuntimeException e) {
            log.debug("[{}] Command '{}' failed: {}", correlationId, command.commandId(), e.getMessage());
            publish(CommandChannels.errorSubject(correlationId), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private void publish(String subject, String payload) {
        try {
            transport.publish(subject, payload.getBytes(StandardCharsets.UTF_8));
        } catch (TransportException e) {
            log.error(msg("Failed to publish outcome to '{}'", subject), e);
        }
    }

    private static void reply(Message message, CommandReply reply) {
        if (message.isRequest()) {
            message.respond(reply.encode());
        } else {
            log.debug("Command on '{}' wasn't sent as a request, dropping reply '{}'", message.subject(), reply);
        }
    }
}
