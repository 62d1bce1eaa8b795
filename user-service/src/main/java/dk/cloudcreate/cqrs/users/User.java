package dk.cloudcreate.cqrs.users;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.common.types.AggregateType;
import dk.cloudcreate.cqrs.users.UserCommand.*;
import dk.cloudcreate.cqrs.users.UserEvent.*;
import org.slf4j.*;

import java.util.*;

/**
 * The user aggregate. Its state is rebuilt from {@link UserEvent}'s and changed through {@link UserCommand}'s
 */
public class User extends AbstractAggregateRoot {
    private static final Logger log = LoggerFactory.getLogger(User.class);

    public static final AggregateType USERS = AggregateType.of("user");

    private String  email;
    private String  password;
    private boolean enabled;

    public User() {
    }

    public String email() {
        return email;
    }

    public String password() {
        return password;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void handleCommand(Command<?> command) {
        if (!(command.payload() instanceof UserCommand)) {
            throw UnknownCommandException.forCommand(command, this);
        }
        log.trace("[{}] Handling '{}' for user '{}'", command.correlationId(), command.commandId(), aggregateId());
        ((UserCommand) command.payload()).accept(new UserCommand.Visitor() {
            @Override
            public void visit(CreateUser createUser) {
                var userId = UUID.randomUUID().toString();
                applyNewEvent(UserEvent.CREATED, command, userId, new UserCreated(userId, createUser.getEmail(), createUser.getPassword(), false));
            }

            @Override
            public void visit(ChangeUserEmail changeEmail) {
                applyNewEvent(UserEvent.EMAIL_CHANGED, command, new UserEmailChanged(email, changeEmail.getEmail()));
            }

            @Override
            public void visit(ChangeUserPassword changePassword) {
                applyNewEvent(UserEvent.PASSWORD_CHANGED, command, new UserPasswordChanged(password, changePassword.getPassword()));
            }

            @Override
            public void visit(EnableUser enableUser) {
                applyNewEvent(UserEvent.ENABLED, command, new UserEnabled());
            }

            @Override
            public void visit(DisableUser disableUser) {
                applyNewEvent(UserEvent.DISABLED, command, new UserDisabled());
            }

            @Override
            public void visit(ModifyUser modifyUser) {
                // Only changed fields produce events, always in the order email, password, enabled
                if (modifyUser.getEmail() != null && !modifyUser.getEmail().equals(email)) {
                    applyNewEvent(UserEvent.EMAIL_CHANGED, command, new UserEmailChanged(email, modifyUser.getEmail()));
                }
                if (modifyUser.getPassword() != null && !modifyUser.getPassword().equals(password)) {
                    applyNewEvent(UserEvent.PASSWORD_CHANGED, command, new UserPasswordChanged(password, modifyUser.getPassword()));
                }
                if (modifyUser.getEnabled() != null && modifyUser.getEnabled() != enabled) {
                    if (modifyUser.getEnabled()) {
                        applyNewEvent(UserEvent.ENABLED, command, new UserEnabled());
                    } else {
                        applyNewEvent(UserEvent.DISABLED, command, new UserDisabled());
                    }
                }
            }
        });
    }

    @Override
    protected boolean isCreatedBy(Event<?> event) {
        return event.payload() instanceof UserCreated;
    }

    @Override
    protected void applyEventToTheAggregate(Event<?> event) {
        if (!(event.payload() instanceof UserEvent)) {
            throw UnknownEventException.forEvent(event, this);
        }
        ((UserEvent) event.payload()).accept(new UserEvent.Visitor() {
            @Override
            public void visit(UserCreated userCreated) {
                email = userCreated.getEmail();
                password = userCreated.getPassword();
                enabled = userCreated.isEnabled();
            }

            @Override
            public void visit(UserEmailChanged emailChanged) {
                email = emailChanged.getNewEmail();
            }

            @Override
            public void visit(UserPasswordChanged passwordChanged) {
                password = passwordChanged.getNewPassword();
            }

            @Override
            public void visit(UserEnabled userEnabled) {
                enabled = true;
            }

            @Override
            public void visit(UserDisabled userDisabled) {
                enabled = false;
            }
        });
    }

    @Override
    public String toString() {
        return "User{" +
                "id='" + aggregateId() + '\'' +
                ", email='" + email + '\'' +
                ", enabled=" + enabled +
                '}';
    }
}
