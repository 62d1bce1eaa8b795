package dk.cloudcreate.cqrs.users;

import dk.cloudcreate.cqrs.aggregates.AggregateRootFactory;
import dk.cloudcreate.cqrs.aggregates.command.CommandHandler;
import dk.cloudcreate.cqrs.aggregates.eventstore.EventStore;
import dk.cloudcreate.cqrs.aggregates.repository.Repository;
import dk.cloudcreate.cqrs.aggregates.serialization.SerializationRegistry;
import dk.cloudcreate.cqrs.bus.CommandDispatcher;
import dk.cloudcreate.cqrs.bus.transport.MessageTransport;
import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.users.UserCommand.*;
import dk.cloudcreate.cqrs.users.UserEvent.*;
import dk.cloudcreate.cqrs.users.readmodel.UserReadModel;
import dk.cloudcreate.cqrs.users.validation.UniqueEmailValidator;
import org.slf4j.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Wires the user service: the {@link Repository} for {@link User}'s, the {@link CommandHandler} guarded by the
 * {@link UniqueEmailValidator}, the {@link UserReadModel} and a {@link CommandDispatcher} serving <code>command.user</code>.
 * <p>
 * The {@link EventStore} and the {@link MessageTransport} must be started before {@link #start()} is called.
 * The e-mail index and the read model are loaded from the event store on the first {@link #start()}.
 */
public class UserService implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final    MessageTransport      transport;
    private final    EventStore            eventStore;
    private final    SerializationRegistry serializationRegistry;
    private final    Repository            repository;
    private final    CommandHandler        commandHandler;
    private final    CommandDispatcher     commandDispatcher;
    private volatile UniqueEmailValidator  uniqueEmailValidator;
    private volatile UserReadModel         readModel;
    private volatile boolean               started;

    public UserService(MessageTransport transport, EventStore eventStore) {
        this(transport, eventStore, createSerializationRegistry());
    }

    public UserService(MessageTransport transport, EventStore eventStore, SerializationRegistry serializationRegistry) {
        this.transport = requireNonNull(transport, "No transport provided");
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.serializationRegistry = requireNonNull(serializationRegistry, "No serializationRegistry provided");
        this.repository = Repository.from(eventStore)
                                    .registerAggregateRootFactory(User.USERS, AggregateRootFactory.defaultConstructor(User.class));
        this.commandHandler = CommandHandler.from(repository);
        this.commandDispatcher = new CommandDispatcher(transport, serializationRegistry, commandHandler, List.of(User.USERS));
    }

    /**
     * A registry containing every {@link UserCommand} and {@link UserEvent}
     */
    public static SerializationRegistry createSerializationRegistry() {
        return registerUserTypes(new SerializationRegistry());
    }

    public static SerializationRegistry registerUserTypes(SerializationRegistry serializationRegistry) {
        requireNonNull(serializationRegistry, "No serializationRegistry provided");
        return serializationRegistry.registerCommand(UserCommand.CREATE, CreateUser.class)
                                    .registerCommand(UserCommand.CHANGE_EMAIL, ChangeUserEmail.class)
                                    .registerCommand(UserCommand.CHANGE_PASSWORD, ChangeUserPassword.class)
                                    .registerCommand(UserCommand.ENABLE, EnableUser.class)
                                    .registerCommand(UserCommand.DISABLE, DisableUser.class)
                                    .registerCommand(UserCommand.MODIFY, ModifyUser.class)
                                    .registerEvent(UserEvent.CREATED, UserCreated.class)
                                    .registerEvent(UserEvent.EMAIL_CHANGED, UserEmailChanged.class)
                                    .registerEvent(UserEvent.PASSWORD_CHANGED, UserPasswordChanged.class)
                                    .registerEvent(UserEvent.ENABLED, UserEnabled.class)
                                    .registerEvent(UserEvent.DISABLED, UserDisabled.class);
    }

    @Override
    public void start() {
        if (!started) {
            log.info("Starting user service");
            if (uniqueEmailValidator == null) {
                uniqueEmailValidator = UniqueEmailValidator.initializeFrom(eventStore);
                commandHandler.addValidator(uniqueEmailValidator);
                readModel = UserReadModel.initializeFrom(eventStore);
            }
            commandDispatcher.start();
            started = true;
            log.info("Started user service");
        } else {
            log.debug("User service was already started");
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("Stopping user service");
            commandDispatcher.stop();
            started = false;
            log.info("Stopped user service");
        } else {
            log.debug("User service was already stopped");
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    public SerializationRegistry serializationRegistry() {
        return serializationRegistry;
    }

    public Repository repository() {
        return repository;
    }

    public CommandHandler commandHandler() {
        return commandHandler;
    }

    /**
     * @throws IllegalStateException if the service has never been started
     */
    public UserReadModel readModel() {
        if (readModel == null) {
            throw new IllegalStateException("The user service hasn't been started");
        }
        return readModel;
    }

    public MessageTransport transport() {
        return transport;
    }
}
