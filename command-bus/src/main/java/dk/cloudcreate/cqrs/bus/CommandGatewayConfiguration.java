package dk.cloudcreate.cqrs.bus;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Timeouts used by the {@link CommandGateway}
 */
public final class CommandGatewayConfiguration {
    public static final Duration DEFAULT_ACK_TIMEOUT     = Duration.ofSeconds(1);
    public static final Duration DEFAULT_OUTCOME_TIMEOUT = Duration.ofSeconds(5);

    /**
     * How long to wait for the immediate <code>ok:</code>/<code>error:</code> reply to a command request
     */
    public final Duration ackTimeout;
    /**
     * How long {@link CommandGateway#sendAndWait(dk.cloudcreate.cqrs.aggregates.command.Command)} waits for the outcome
     */
    public final Duration outcomeTimeout;

    public CommandGatewayConfiguration(Duration ackTimeout, Duration outcomeTimeout) {
        this.ackTimeout = requireNonNull(ackTimeout, "No ackTimeout provided");
        this.outcomeTimeout = requireNonNull(outcomeTimeout, "No outcomeTimeout provided");
        requireTrue(!ackTimeout.isNegative() && !ackTimeout.isZero(), "ackTimeout must be positive");
        requireTrue(!outcomeTimeout.isNegative() && !outcomeTimeout.isZero(), "outcomeTimeout must be positive");
    }

    public static CommandGatewayConfiguration defaultConfiguration() {
        return new CommandGatewayConfiguration(DEFAULT_ACK_TIMEOUT, DEFAULT_OUTCOME_TIMEOUT);
    }

    public CommandGatewayConfiguration withOutcomeTimeout(Duration outcomeTimeout) {
        return new CommandGatewayConfiguration(ackTimeout, outcomeTimeout);
    }

    @Override
    public String toString() {
        return "CommandGatewayConfiguration{" +
                "ackTimeout=" + ackTimeout +
                ", outcomeTimeout=" + outcomeTimeout +
                '}';
    }
}
