package dk.cloudcreate.cqrs.aggregates.repository;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.eventstore.*;
import dk.cloudcreate.cqrs.common.types.AggregateType;
import org.slf4j.*;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Loads {@link AggregateRoot}'s by replaying their events from an {@link EventStore} and saves their uncommitted changes back to it.<br>
 * Aggregates are never cached: every {@link #load(AggregateType, String)} replays the full history.
 * <p>
 * Use {@link #from(EventStore)} to create the {@link DefaultRepository}
 */
public interface Repository {
    static Repository from(EventStore eventStore) {
        return new DefaultRepository(eventStore);
    }

    /**
     * Register the factory that creates empty aggregate instances of the given type. Registering the same aggregate type again
     * replaces the previous factory
     *
     * @param aggregateType        the aggregate type
     * @param aggregateRootFactory the factory
     * @return this repository instance
     */
    Repository registerAggregateRootFactory(AggregateType aggregateType, AggregateRootFactory aggregateRootFactory);

    /**
     * Load an aggregate. If <code>aggregateId</code> is empty the empty aggregate is returned without consulting the {@link EventStore}.
     * If no events exist for the aggregate id the empty aggregate is returned as well.
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id (may be empty)
     * @return the aggregate with all its historic events applied
     * @throws UnknownAggregateTypeException if no factory has been registered for <code>aggregateType</code>
     * @throws EventStoreException           if the events couldn't be loaded
     */
    AggregateRoot load(AggregateType aggregateType, String aggregateId);

    /**
     * Persist the {@link AggregateRoot#uncommittedChanges()} of the aggregate as one batch and afterwards mark them as committed.<br>
     * If the {@link EventStore} fails the uncommitted changes are kept on the aggregate.
     *
     * @param aggregateRoot the aggregate to save
     * @throws EventStoreException if the events couldn't be persisted
     */
    void save(AggregateRoot aggregateRoot);

    /**
     * The {@link EventStore} this repository loads from and saves to
     */
    EventStore eventStore();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultRepository implements Repository {
        private static final Logger log = LoggerFactory.getLogger(Repository.class);

        private final EventStore                                         eventStore;
        private final ConcurrentMap<AggregateType, AggregateRootFactory> aggregateRootFactories = new ConcurrentHashMap<>();

        public DefaultRepository(EventStore eventStore) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
        }

        @Override
        public DefaultRepository registerAggregateRootFactory(AggregateType aggregateType, AggregateRootFactory aggregateRootFactory) {
            requireNonNull(aggregateType, "No aggregateType provided");
            requireNonNull(aggregateRootFactory, "No aggregateRootFactory provided");
            log.debug("Registering AggregateRootFactory for aggregateType '{}'", aggregateType);
            aggregateRootFactories.put(aggregateType, aggregateRootFactory);
            return this;
        }

        @Override
        public AggregateRoot load(AggregateType aggregateType, String aggregateId) {
            requireNonNull(aggregateType, "No aggregateType provided");
            requireNonNull(aggregateId, "No aggregateId provided");
            var factory = aggregateRootFactories.get(aggregateType);
            if (factory == null) {
                throw new UnknownAggregateTypeException(aggregateType);
            }
            var aggregateRoot = factory.create();
            if (aggregateId.isEmpty()) {
                log.trace("[{}] No aggregateId provided. Returning an empty aggregate", aggregateType);
                return aggregateRoot;
            }

            log.trace("[{}] Trying to load aggregate with id '{}'", aggregateType, aggregateId);
            var events = eventStore.load(aggregateId);
            events.forEach(event -> aggregateRoot.apply(false, event));
            log.debug("[{}] Loaded aggregate with id '{}' by replaying {} event(s)", aggregateType, aggregateId, events.size());
            return aggregateRoot;
        }

        @Override
        public void save(AggregateRoot aggregateRoot) {
            requireNonNull(aggregateRoot, "No aggregateRoot provided");
            var eventsToPersist = aggregateRoot.uncommittedChanges();
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'", aggregateRoot.getClass().getName(), aggregateRoot.aggregateId());
                return;
            }
            log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                      eventsToPersist.size(),
                      aggregateRoot.getClass().getName(),
                      aggregateRoot.aggregateId());
            eventStore.save(eventsToPersist);
            aggregateRoot.markChangesAsCommitted();
        }

        @Override
        public EventStore eventStore() {
            return eventStore;
        }

        @Override
        public String toString() {
            return "DefaultRepository{" +
                    "aggregateTypes=" + aggregateRootFactories.keySet() +
                    '}';
        }
    }
}
