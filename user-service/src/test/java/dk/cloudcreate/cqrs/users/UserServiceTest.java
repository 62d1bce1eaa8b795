package dk.cloudcreate.cqrs.users;

import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.eventstore.InMemoryEventStore;
import dk.cloudcreate.cqrs.bus.*;
import dk.cloudcreate.cqrs.bus.outcome.RemoteCommandException;
import dk.cloudcreate.cqrs.bus.transport.LocalMessageTransport;
import dk.cloudcreate.cqrs.common.types.CorrelationId;
import dk.cloudcreate.cqrs.users.UserCommand.CreateUser;
import dk.cloudcreate.cqrs.users.UserEvent.*;
import dk.cloudcreate.cqrs.users.client.UsersClient;
import dk.cloudcreate.cqrs.users.readmodel.UserView;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Drives the {@link UserService} through the {@link UsersClient} over a {@link LocalMessageTransport}
 */
class UserServiceTest {
    private LocalMessageTransport transport;
    private InMemoryEventStore    eventStore;
    private UserService           userService;
    private CommandGateway        gateway;
    private UsersClient           usersClient;

    @BeforeEach
    void setup() {
        transport = new LocalMessageTransport("Test", 4);
        transport.start();
        eventStore = new InMemoryEventStore();
        userService = new UserService(transport, eventStore);
        userService.start();
        gateway = new CommandGateway(transport, UserService.createSerializationRegistry());
        usersClient = new UsersClient(gateway);
    }

    @AfterEach
    void cleanup() {
        userService.stop();
        transport.stop();
    }

    @Test
    void create_user_returns_the_id_of_a_new_disabled_user() {
        // When
        var userId = usersClient.createUser("a@x.com", "hashed:abc");

        // Then
        assertThat(userId).isNotEmpty();
        var events = eventStore.load(userId);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).payload()).isEqualTo(new UserCreated(userId, "a@x.com", "hashed:abc", false));
        assertThat(userService.readModel().findUser(userId)).hasValueSatisfying(view -> {
            assertThat(view.getEmail()).isEqualTo("a@x.com");
            assertThat(view.isEnabled()).isFalse();
        });
    }

    @Test
    void change_email_is_reflected_in_the_history_and_the_read_model() {
        // Given
        var userId = usersClient.createUser("a@x.com", "hashed:abc");

        // When
        usersClient.changeEmail(userId, "b@x.com");

        // Then
        assertThat(eventStore.load(userId)).extracting(event -> event.payload())
                                           .containsExactly(new UserCreated(userId, "a@x.com", "hashed:abc", false),
                                                            new UserEmailChanged("a@x.com", "b@x.com"));
        assertThat(userService.readModel().findUser(userId).map(UserView::getEmail)).contains("b@x.com");
    }

    @Test
    void every_client_operation_reaches_the_aggregate() {
        // Given
        var userId = usersClient.createUser("a@x.com", "hashed:abc");

        // When
        usersClient.enable(userId);
        usersClient.changePassword(userId, "hashed:def");
        usersClient.disable(userId);
        usersClient.modify(userId, "c@x.com", null, true);

        // Then
        assertThat(eventStore.load(userId)).extracting(event -> event.payload())
                                           .containsExactly(new UserCreated(userId, "a@x.com", "hashed:abc", false),
                                                            new UserEnabled(),
                                                            new UserPasswordChanged("hashed:abc", "hashed:def"),
                                                            new UserDisabled(),
                                                            new UserEmailChanged("a@x.com", "c@x.com"),
                                                            new UserEnabled());
        var user = (User) userService.repository().load(User.USERS, userId);
        assertThat(user.email()).isEqualTo("c@x.com");
        assertThat(user.isEnabled()).isTrue();
    }

    @Test
    void enabling_an_unknown_user_returns_a_remote_error_and_persists_nothing() {
        assertThatThrownBy(() -> usersClient.enable("unknown-user"))
                .isInstanceOf(RemoteCommandException.class)
                .hasMessageContaining("doesn't exist");
        assertThat(eventStore.load("unknown-user")).isEmpty();
    }

    @Test
    void a_duplicate_email_is_returned_as_a_remote_error() {
        // Given
        usersClient.createUser("a@x.com", "hashed:abc");

        // Then
        assertThatThrownBy(() -> usersClient.createUser("a@x.com", "hashed:xyz"))
                .isInstanceOf(RemoteCommandException.class)
                .hasMessageContaining("already in use");
        assertThat(userService.readModel().allUsers()).hasSize(1);
    }

    @Test
    void a_second_outcome_for_the_same_correlation_id_never_replaces_the_first() {
        // Given
        var correlationId        = CorrelationId.random();
        var outcomeSubscriptions = gateway.outcomeSubscriptions();
        outcomeSubscriptions.subscribe(correlationId);
        try {
            // When
            gateway.send(Command.creating(UserCommand.CREATE, User.USERS, correlationId, new CreateUser("a@x.com", "hashed:abc")));
            gateway.send(Command.creating(UserCommand.CREATE, User.USERS, correlationId, new CreateUser("b@x.com", "hashed:abc")));
            var first = outcomeSubscriptions.awaitOutcome(correlationId, Duration.ofSeconds(5));
            await().atMost(Duration.ofSeconds(5)).until(() -> userService.readModel().allUsers().size() == 2);

            // Then
            assertThat(userService.readModel().findUser(first)).isPresent();
            assertThat(outcomeSubscriptions.awaitOutcome(correlationId, Duration.ofMillis(100))).isEqualTo(first);
        } finally {
            outcomeSubscriptions.unsubscribe(correlationId);
        }
    }

    @Test
    void a_restarted_service_keeps_its_state() {
        // Given
        var userId = usersClient.createUser("a@x.com", "hashed:abc");

        // When
        userService.stop();
        userService.start();

        // Then
        assertThat(userService.isStarted()).isTrue();
        usersClient.enable(userId);
        assertThat(userService.readModel().findUser(userId).map(UserView::isEnabled)).contains(true);
    }

    @Test
    void a_new_service_instance_loads_existing_users_from_the_event_store() {
        // Given
        var userId = usersClient.createUser("a@x.com", "hashed:abc");
        userService.stop();

        // When
        userService = new UserService(transport, eventStore);
        userService.start();

        // Then
        assertThat(userService.readModel().findUser(userId)).isPresent();
        assertThatThrownBy(() -> usersClient.createUser("a@x.com", "hashed:abc"))
                .isInstanceOf(RemoteCommandException.class);
    }
}
