package dk.cloudcreate.cqrs.common.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * The identifier of a command shape, e.g. <b>user.create</b>.<br>
 * The identifier is what travels on the wire and is resolved back to a payload type through the serialization registry
 */
public class CommandId extends CharSequenceType<CommandId> {
    public CommandId(CharSequence value) {
        super(value);
    }

    public static CommandId of(CharSequence value) {
        return new CommandId(value);
    }
}
