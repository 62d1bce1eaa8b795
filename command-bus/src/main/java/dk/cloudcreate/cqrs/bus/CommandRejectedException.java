package dk.cloudcreate.cqrs.bus;

/**
 * The receiving side answered a command request with an <code>error:</code> reply, e.g. because it couldn't decode the command.
 * The command was never handled
 */
public class CommandRejectedException extends CommandBusException {
    public CommandRejectedException(String message) {
        super(message);
    }
}
