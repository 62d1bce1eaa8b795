package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The identifier of an event shape, e.g. <b>user.created</b>.<br>
 * Persisted together with the event payload so the payload can be decoded again when the event is loaded
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }
}
