package dk.cloudcreate.cqrs.aggregates.command;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.eventstore.EventStoreException;
import dk.cloudcreate.cqrs.aggregates.repository.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Executes a {@link Command} end to end against the target aggregate:
 * <ol>
 *     <li>load the aggregate through the {@link Repository}</li>
 *     <li>run the command's own validation ({@link Command#validate(AggregateRoot)})</li>
 *     <li>run every registered {@link CommandValidator} and report all their failures together</li>
 *     <li>let the aggregate handle the command</li>
 *     <li>check that the aggregate has an identity</li>
 *     <li>save the aggregate's uncommitted changes</li>
 * </ol>
 * The first failing step aborts the handling and nothing is persisted. Commands are never retried.
 * <p>
 * Use {@link #from(Repository)} to create the {@link DefaultCommandHandler}
 */
public interface CommandHandler {
    static CommandHandler from(Repository repository) {
        return new DefaultCommandHandler(repository);
    }

    /**
     * Register a cross-cutting validator that is run for every command
     *
     * @param validator the validator
     * @return this command handler instance
     */
    CommandHandler addValidator(CommandValidator validator);

    /**
     * Handle the command
     *
     * @param command the command
     * @return the aggregate id and the events persisted as a result of the command
     * @throws CommandValidationException           if the command was rejected by its own validation or by a {@link CommandValidator}
     * @throws UnknownAggregateTypeException        if the command targets an aggregate type the {@link Repository} doesn't know
     * @throws UnknownCommandException              if the aggregate doesn't support the command
     * @throws AggregateInvariantViolationException if the aggregate had no identity after handling the command
     * @throws EventStoreException                  if loading or persisting events failed
     */
    HandledCommand handle(Command<?> command);

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultCommandHandler implements CommandHandler {
        private static final Logger log = LoggerFactory.getLogger(CommandHandler.class);

        private final Repository             repository;
        private final List<CommandValidator> validators = new CopyOnWriteArrayList<>();

        public DefaultCommandHandler(Repository repository) {
            this.repository = requireNonNull(repository, "You must supply a Repository instance");
        }

        @Override
        public DefaultCommandHandler addValidator(CommandValidator validator) {
            validators.add(requireNonNull(validator, "No validator provided"));
            return this;
        }

        @Override
        public HandledCommand handle(Command<?> command) {
            requireNonNull(command, "No command provided");
            log.debug("[{}:{}] Handling command '{}' for aggregate with id '{}'",
                      command.aggregateType(),
                      command.correlationId(),
                      command.commandId(),
                      command.aggregateId());

            var aggregateRoot = repository.load(command.aggregateType(), command.aggregateId());

            command.validate(aggregateRoot);
            runValidators(command, aggregateRoot);

            aggregateRoot.handleCommand(command);
            if (!aggregateRoot.hasIdentity()) {
                var message = msg("[{}:{}] Aggregate '{}' has no aggregateId after handling command '{}'",
                                  command.aggregateType(),
                                  command.correlationId(),
                                  aggregateRoot.getClass().getName(),
                                  command.commandId());
                log.error(message);
                throw new AggregateInvariantViolationException(message);
            }

            var eventsToPersist = aggregateRoot.uncommittedChanges();
            repository.save(aggregateRoot);
            log.debug("[{}:{}] Command '{}' resulted in {} event(s) for aggregate with id '{}'",
                      command.aggregateType(),
                      command.correlationId(),
                      command.commandId(),
                      eventsToPersist.size(),
                      aggregateRoot.aggregateId());
            return new HandledCommand(aggregateRoot.aggregateId(), eventsToPersist);
        }

        private void runValidators(Command<?> command, AggregateRoot aggregateRoot) {
            var failures = new ArrayList<RuntimeException>();
            validators.forEach(validator -> {
                try {
                    validator.validate(command, aggregateRoot);
                } catch (RuntimeException e) {
                    log.trace("[{}:{}] Validator '{}' rejected command '{}': {}",
                              command.aggregateType(),
                              command.correlationId(),
                              validator,
                              command.commandId(),
                              e.getMessage());
                    failures.add(e);
                }
            });
            if (!failures.isEmpty()) {
                throw CommandValidationException.combine(failures);
            }
        }
    }
}
