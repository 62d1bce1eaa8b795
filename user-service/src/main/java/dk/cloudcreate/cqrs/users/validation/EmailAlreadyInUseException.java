package dk.cloudcreate.cqrs.users.validation;

import dk.cloudcreate.cqrs.aggregates.command.CommandValidationException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class EmailAlreadyInUseException extends CommandValidationException {
    public final String email;

    public EmailAlreadyInUseException(String email) {
        super(msg("Email '{}' is already in use", email));
        this.email = email;
    }
}
