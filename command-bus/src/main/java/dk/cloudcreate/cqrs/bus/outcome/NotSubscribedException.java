package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.bus.CommandBusException;
import dk.cloudcreate.cqrs.common.types.CorrelationId;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class NotSubscribedException extends CommandBusException {
    public NotSubscribedException(CorrelationId correlationId) {
        super(msg("Not subscribed to outcomes for correlation id '{}'", correlationId));
    }
}
