package dk.cloudcreate.cqrs.aggregates.repository;

import dk.cloudcreate.cqrs.aggregates.AggregateException;
import dk.cloudcreate.cqrs.common.types.AggregateType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class UnknownAggregateTypeException extends AggregateException {
    public final AggregateType aggregateType;

    public UnknownAggregateTypeException(AggregateType aggregateType) {
        super(msg("No AggregateRootFactory has been registered for aggregateType '{}'", aggregateType));
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
    }
}
