package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.bus.CommandBusException;
import dk.cloudcreate.cqrs.common.types.CorrelationId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A second outcome arrived for a correlation id whose outcome was already delivered. The first outcome is kept
 */
public class OutcomeAlreadyDeliveredException extends CommandBusException {
    public final Outcome rejectedOutcome;

    public OutcomeAlreadyDeliveredException(Outcome rejectedOutcome) {
        super(msg("An outcome was already delivered for correlation id '{}'", rejectedOutcome.correlationId()));
        this.rejectedOutcome = rejectedOutcome;
    }
}
