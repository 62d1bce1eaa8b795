package dk.cloudcreate.cqrs.aggregates.serialization;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The command or event identifier found in the encoded data hasn't been registered with the {@link SerializationRegistry}
 */
public class UnknownIdentifierException extends SerializationException {
    public final String identifier;

    public UnknownIdentifierException(String kind, String identifier) {
        super(msg("Unknown {} identifier '{}'", kind, identifier));
        this.identifier = requireNonNull(identifier, "No identifier provided");
    }
}
