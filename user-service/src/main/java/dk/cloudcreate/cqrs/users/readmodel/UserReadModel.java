package dk.cloudcreate.cqrs.users.readmodel;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.eventstore.*;
import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.users.UserEvent;
import dk.cloudcreate.cqrs.users.UserEvent.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Denormalized, in-memory projection of every user, kept current as an {@link EventHook}.<br>
 * The projection is eventually consistent with the event store: it's updated after the events have been persisted.
 */
public class UserReadModel extends CatchingUpEventHook {
    private static final Logger log = LoggerFactory.getLogger(UserReadModel.class);

    private final Map<String, UserView> users = new ConcurrentHashMap<>();

    /**
     * Create a read model containing every user persisted so far and register it as an after-save hook on the event store
     */
    public static UserReadModel initializeFrom(EventStore eventStore) {
        requireNonNull(eventStore, "No eventStore provided");
        var readModel = new UserReadModel();
        var events    = readModel.catchUp(eventStore, UserEvent.ALL);
        log.info("Initialized with {} user(s) from {} event(s)", readModel.users.size(), events);
        return readModel;
    }

    @Override
    protected void project(Event<?> event) {
        if (!(event.payload() instanceof UserEvent)) {
            return;
        }
        var userId        = event.aggregateId();
        var correlationId = event.correlationId();
        ((UserEvent) event.payload()).accept(new UserEvent.Visitor() {
            @Override
            public void visit(UserCreated userCreated) {
                users.put(userId, new UserView(userId, userCreated.getEmail(), userCreated.isEnabled(), correlationId));
            }

            @Override
            public void visit(UserEmailChanged emailChanged) {
                update(userId, view -> view.withEmail(emailChanged.getNewEmail(), correlationId));
            }

            @Override
            public void visit(UserPasswordChanged passwordChanged) {
                update(userId, view -> view.touchedBy(correlationId));
            }

            @Override
            public void visit(UserEnabled userEnabled) {
                update(userId, view -> view.withEnabled(true, correlationId));
            }

            @Override
            public void visit(UserDisabled userDisabled) {
                update(userId, view -> view.withEnabled(false, correlationId));
            }
        });
    }

    private void update(String userId, UnaryOperator<UserView> change) {
        if (users.computeIfPresent(userId, (id, view) -> change.apply(view)) == null) {
            log.warn("Received an event for unknown user '{}'", userId);
        }
    }

    public Optional<UserView> findUser(String userId) {
        return Optional.ofNullable(users.get(requireNonNull(userId, "No userId provided")));
    }

    public Optional<UserView> findUserByEmail(String email) {
        requireNonNull(email, "No email provided");
        return users.values().stream().filter(view -> email.equals(view.getEmail())).findFirst();
    }

    public List<UserView> allUsers() {
        return List.copyOf(users.values());
    }

    /**
     * @return the correlation id of the last command that changed the user
     */
    public Optional<CorrelationId> lastCorrelationId(String userId) {
        return findUser(userId).map(UserView::getLastCorrelationId);
    }
}
