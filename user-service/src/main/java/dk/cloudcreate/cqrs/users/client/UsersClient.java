package dk.cloudcreate.cqrs.users.client;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.bus.CommandGateway;
import dk.cloudcreate.cqrs.common.types.*;
import dk.cloudcreate.cqrs.users.*;
import dk.cloudcreate.cqrs.users.UserCommand.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Caller side API for the user service. Every operation sends one {@link UserCommand} with a fresh correlation id and waits for its outcome.
 * <p>
 * All operations throw:
 * <ul>
 *     <li>{@link dk.cloudcreate.cqrs.bus.outcome.RemoteCommandException} if the service rejected or failed the command</li>
 *     <li>{@link dk.cloudcreate.cqrs.bus.outcome.OutcomeTimeoutException} if no outcome arrived in time</li>
 *     <li>{@link dk.cloudcreate.cqrs.bus.CommandRejectedException} if the service couldn't accept the command</li>
 * </ul>
 */
public class UsersClient {
    private final CommandGateway commandGateway;

    public UsersClient(CommandGateway commandGateway) {
        this.commandGateway = requireNonNull(commandGateway, "No commandGateway provided");
    }

    /**
     * @return the id of the new user
     */
    public String createUser(String email, String hashedPassword) {
        return commandGateway.sendAndWait(Command.creating(UserCommand.CREATE, User.USERS, CorrelationId.random(), new CreateUser(email, hashedPassword)));
    }

    public void changeEmail(String userId, String email) {
        send(UserCommand.CHANGE_EMAIL, userId, new ChangeUserEmail(email));
    }

    public void changePassword(String userId, String hashedPassword) {
        send(UserCommand.CHANGE_PASSWORD, userId, new ChangeUserPassword(hashedPassword));
    }

    public void enable(String userId) {
        send(UserCommand.ENABLE, userId, new EnableUser());
    }

    public void disable(String userId) {
        send(UserCommand.DISABLE, userId, new DisableUser());
    }

    /**
     * Change the non-<code>null</code> fields
     */
    public void modify(String userId, String email, String hashedPassword, Boolean enabled) {
        send(UserCommand.MODIFY, userId, new ModifyUser(email, hashedPassword, enabled));
    }

    private void send(CommandId commandId, String userId, UserCommand payload) {
        requireNonNull(userId, "No userId provided");
        commandGateway.sendAndWait(Command.of(commandId, User.USERS, userId, CorrelationId.random(), payload));
    }
}
