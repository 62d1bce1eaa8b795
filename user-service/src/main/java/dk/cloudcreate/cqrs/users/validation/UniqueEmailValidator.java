package dk.cloudcreate.cqrs.users.validation;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;
import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.eventstore.*;
import dk.cloudcreate.cqrs.users.*;
import dk.cloudcreate.cqrs.users.UserCommand.*;
import dk.cloudcreate.cqrs.users.UserEvent.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Rejects commands that would give a user an e-mail address another user already has.
 * <p>
 * The set of e-mails in use is loaded from the {@link EventStore} by {@link #initializeFrom(EventStore)} and kept current
 * as an {@link EventHook}, which is registered before the history is loaded so no e-mail claimed meanwhile is missed. The check and the later save aren't atomic, so two concurrent commands can still claim the same e-mail.
 */
public class UniqueEmailValidator extends CatchingUpEventHook implements CommandValidator {
    private static final Logger log = LoggerFactory.getLogger(UniqueEmailValidator.class);

    private final Set<String> emailsInUse = ConcurrentHashMap.newKeySet();

    /**
     * Create a validator seeded with every e-mail claimed so far and register it as an after-save hook on the event store
     */
    public static UniqueEmailValidator initializeFrom(EventStore eventStore) {
        requireNonNull(eventStore, "No eventStore provided");
        var validator = new UniqueEmailValidator();
        var events    = validator.catchUp(eventStore, List.of(UserEvent.CREATED, UserEvent.EMAIL_CHANGED));
        log.info("Initialized with {} e-mail(s) in use from {} event(s)", validator.emailsInUse.size(), events);
        return validator;
    }

    @Override
    public void validate(Command<?> command, AggregateRoot aggregateRoot) {
        var payload = command.payload();
        String requestedEmail = null;
        if (payload instanceof CreateUser) {
            requestedEmail = ((CreateUser) payload).getEmail();
        } else if (payload instanceof ChangeUserEmail) {
            requestedEmail = ((ChangeUserEmail) payload).getEmail();
        } else if (payload instanceof ModifyUser) {
            requestedEmail = ((ModifyUser) payload).getEmail();
        }
        if (requestedEmail == null) {
            return;
        }
        if (aggregateRoot instanceof User && requestedEmail.equals(((User) aggregateRoot).email())) {
            // The user keeps its own e-mail
            return;
        }
        if (emailsInUse.contains(requestedEmail)) {
            throw new EmailAlreadyInUseException(requestedEmail);
        }
    }

    @Override
    protected void project(Event<?> event) {
        var payload = event.payload();
        if (payload instanceof UserCreated) {
            emailsInUse.add(((UserCreated) payload).getEmail());
        } else if (payload instanceof UserEmailChanged) {
            var emailChanged = (UserEmailChanged) payload;
            if (emailChanged.getOldEmail() != null) {
                emailsInUse.remove(emailChanged.getOldEmail());
            }
            emailsInUse.add(emailChanged.getNewEmail());
        }
    }

    public boolean isInUse(String email) {
        return emailsInUse.contains(requireNonNull(email, "No email provided"));
    }
}
