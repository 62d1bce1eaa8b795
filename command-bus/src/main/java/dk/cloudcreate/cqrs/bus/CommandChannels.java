package dk.cloudcreate.cqrs.bus;

import dk.cloudcreate.cqrs.common.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Subject names used between the command sender and the {@link CommandDispatcher}:
 * <ul>
 *     <li><code>command.&lt;aggregateType&gt;</code> - commands, sent as requests</li>
 *     <li><code>event.&lt;correlationId&gt;.success</code> - the aggregate id of a successfully handled command</li>
 *     <li><code>event.&lt;correlationId&gt;.error</code> - the error message of a failed command</li>
 * </ul>
 */
public final class CommandChannels {
    public static final String COMMAND_PREFIX = "command";
    public static final String OUTCOME_PREFIX = "event";
    public static final String SUCCESS        = "success";
    public static final String ERROR          = "error";

    /**
     * Matches every command subject
     */
    public static final String ALL_COMMANDS = COMMAND_PREFIX + ".>";
    /**
     * Matches every outcome subject
     */
    public static final String ALL_OUTCOMES = OUTCOME_PREFIX + ".>";

    private CommandChannels() {
    }

    public static String commandSubject(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return COMMAND_PREFIX + "." + aggregateType;
    }

    public static String outcomeSubjectPattern(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        return OUTCOME_PREFIX + "." + correlationId + ".*";
    }

    public static String successSubject(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        return OUTCOME_PREFIX + "." + correlationId + "." + SUCCESS;
    }

    public static String errorSubject(CorrelationId correlationId) {
        requireNonNull(correlationId, "No correlationId provided");
        return OUTCOME_PREFIX + "." + correlationId + "." + ERROR;
    }

    public static boolean isErrorSubject(String subject) {
        requireNonNull(subject, "No subject provided");
        return subject.startsWith(OUTCOME_PREFIX + ".") && subject.endsWith("." + ERROR);
    }
}
