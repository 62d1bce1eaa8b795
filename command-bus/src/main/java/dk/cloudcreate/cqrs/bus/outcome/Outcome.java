package dk.cloudcreate.cqrs.bus.outcome;

import dk.cloudcreate.cqrs.common.types.CorrelationId;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The asynchronously published result of handling a command: either a success carrying the aggregate id
 * or a failure carrying the error message
 */
public final class Outcome {
    private final CorrelationId correlationId;
    private final boolean       success;
    private final String        value;

    private Outcome(CorrelationId correlationId, boolean success, String value) {
        this.correlationId = requireNonNull(correlationId, "No correlationId provided");
        this.success = success;
        this.value = requireNonNull(value, "No value provided");
    }

    public static Outcome success(CorrelationId correlationId, String aggregateId) {
        return new Outcome(correlationId, true, aggregateId);
    }

    public static Outcome failure(CorrelationId correlationId, String errorMessage) {
        return new Outcome(correlationId, false, errorMessage);
    }

    public CorrelationId correlationId() {
        return correlationId;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * The aggregate id for a successful outcome, otherwise the error message
     */
    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Outcome)) return false;
        var outcome = (Outcome) o;
        return success == outcome.success && correlationId.equals(outcome.correlationId) && value.equals(outcome.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, success, value);
    }

    @Override
    public String toString() {
        return "Outcome{" +
                "correlationId=" + correlationId +
                ", success=" + success +
                ", value='" + value + '\'' +
                '}';
    }
}
