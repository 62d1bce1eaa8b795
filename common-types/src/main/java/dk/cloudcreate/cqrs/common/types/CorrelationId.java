package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Identifier chosen by the sender of a command. Every event caused by the command, and the
 * final outcome notification, carry the same correlation id
 */
public class CorrelationId extends CharSequenceType<CorrelationId> {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }
}
