package dk.cloudcreate.cqrs.bus;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.serialization.SerializationRegistry;
import dk.cloudcreate.cqrs.bus.outcome.*;
import dk.cloudcreate.cqrs.bus.transport.*;
import org.slf4j.*;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Sends commands to the {@link CommandDispatcher} serving the command's aggregate type and optionally waits for their outcome
 */
public class CommandGateway {
    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    private final MessageTransport            transport;
    private final SerializationRegistry       serializationRegistry;
    private final CommandGatewayConfiguration configuration;
    private final OutcomeSubscriptions        outcomeSubscriptions;

    public CommandGateway(MessageTransport transport, SerializationRegistry serializationRegistry) {
        this(transport, serializationRegistry, CommandGatewayConfiguration.defaultConfiguration());
    }

    public CommandGateway(MessageTransport transport,
                          SerializationRegistry serializationRegistry,
                          CommandGatewayConfiguration configuration) {
        this.transport = requireNonNull(transport, "No transport provided");
        this.serializationRegistry = requireNonNull(serializationRegistry, "No serializationRegistry provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.outcomeSubscriptions = new OutcomeSubscriptions(transport);
    }

    /**
     * Send the command without waiting for its outcome
     *
     * @param command the command
     * @throws CommandRejectedException if the receiver couldn't accept the command
     * @throws TransportException       if the command couldn't be sent or wasn't acknowledged in time
     */
    public void send(Command<?> command) {
        requireNonNull(command, "No command provided");
        var subject = CommandChannels.commandSubject(command.aggregateType());
        log.debug("[{}] Sending command '{}' to '{}'", command.correlationId(), command.commandId(), subject);
        var reply = CommandReply.decode(transport.request(subject,
                                                          serializationRegistry.marshalCommand(command),
                                                          configuration.ackTimeout));
        if (!reply.isOk()) {
            throw new CommandRejectedException(msg("Command '{}' with correlation id '{}' was rejected: {}",
                                                   command.commandId(),
                                                   command.correlationId(),
                                                   reply.text()));
        }
    }

    /**
     * Send the command and wait for its outcome using {@link CommandGatewayConfiguration#outcomeTimeout}
     *
     * @see #sendAndWait(Command, Duration)
     */
    public String sendAndWait(Command<?> command) {
        return sendAndWait(command, configuration.outcomeTimeout);
    }

    /**
     * Send the command and wait for its outcome
     *
     * @param command the command
     * @param timeout how long to wait for the outcome
     * @return the id of the aggregate the command was handled by
     * @throws CommandRejectedException if the receiver couldn't accept the command
     * @throws RemoteCommandException   if handling the command failed
     * @throws OutcomeTimeoutException  if no outcome arrived in time
     */
    public String sendAndWait(Command<?> command, Duration timeout) {
        requireNonNull(command, "No command provided");
        requireNonNull(timeout, "No timeout provided");
        var correlationId = command.correlationId();
        outcomeSubscriptions.subscribe(correlationId);
        try {
            send(command);
            var aggregateId = outcomeSubscriptions.awaitOutcome(correlationId, timeout);
            log.debug("[{}] Command '{}' was handled by aggregate '{}'", correlationId, command.commandId(), aggregateId);
            return aggregateId;
        } finally {
            outcomeSubscriptions.unsubscribe(correlationId);
        }
    }

    public OutcomeSubscriptions outcomeSubscriptions() {
        return outcomeSubscriptions;
    }

    public CommandGatewayConfiguration configuration() {
        return configuration;
    }
}
