package dk.cloudcreate.cqrs.eventstore.postgresql;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.eventstore.*;
import dk.cloudcreate.cqrs.aggregates.serialization.*;
import dk.cloudcreate.cqrs.common.Lifecycle;
import dk.cloudcreate.cqrs.common.types.EventId;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * {@link EventStore} that persists all events in a single PostgreSQL table, accessed through {@link Jdbi}.
 * <p>
 * Each row holds the envelope of an event in separate columns and the payload as <code>jsonb</code>, encoded with the
 * {@link SerializationRegistry}. Every {@link #save(List)} runs in its own transaction, so a batch is persisted completely or not at all.
 * {@link EventHook}'s are invoked after the transaction has committed.
 * <p>
 * The events table is created by {@link #start()} if it doesn't exist.
 */
public class PostgresqlEventStore implements EventStore, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final Jdbi                              jdbi;
    private final SerializationRegistry             serializationRegistry;
    private final PostgresqlEventStoreConfiguration configuration;
    private final EventRowMapper                    rowMapper;
    private final List<EventHook>                   afterSaveHooks = new CopyOnWriteArrayList<>();
    private final String                            insertSql;
    private final String                            loadAggregateEventsSql;
    private final String                            loadEventsOfTypeSql;

    private volatile boolean started;

    public PostgresqlEventStore(Jdbi jdbi, SerializationRegistry serializationRegistry) {
        this(jdbi, serializationRegistry, PostgresqlEventStoreConfiguration.standardConfiguration());
    }

    public PostgresqlEventStore(Jdbi jdbi,
                                SerializationRegistry serializationRegistry,
                                PostgresqlEventStoreConfiguration configuration) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.serializationRegistry = requireNonNull(serializationRegistry, "No serializationRegistry provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.rowMapper = new EventRowMapper(serializationRegistry);
        jdbi.setSqlLogger(new EventStoreSqlLogger());

        insertSql = bind("INSERT INTO {:tableName} (event_id, aggregate_id, aggregate_type, correlation_id, created_at, payload)\n" +
                                 "     VALUES (:eventId, :aggregateId, :aggregateType, :correlationId, :createdAt, :payload::jsonb)",
                         arg("tableName", configuration.eventsTableName));
        loadAggregateEventsSql = bind("SELECT * FROM {:tableName} WHERE aggregate_id = :aggregateId ORDER BY created_at ASC, global_order ASC",
                                      arg("tableName", configuration.eventsTableName));
        loadEventsOfTypeSql = bind("SELECT * FROM {:tableName} WHERE event_id IN (<eventIds>) ORDER BY created_at ASC, global_order ASC",
                                   arg("tableName", configuration.eventsTableName));
    }

    @Override
    public void start() {
        if (!started) {
            log.info("Starting PostgresqlEventStore using {}", configuration);
            jdbi.useTransaction(this::createEventsTableIfMissing);
            started = true;
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("Stopping PostgresqlEventStore");
            started = false;
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    private void createEventsTableIfMissing(Handle handle) {
        var tableName = configuration.eventsTableName;
        int numberOfChanges = handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                                          "    global_order bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                                          "    event_id text NOT NULL,\n" +
                                                          "    aggregate_id text NOT NULL,\n" +
                                                          "    aggregate_type text NOT NULL,\n" +
                                                          "    correlation_id text NOT NULL,\n" +
                                                          "    created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                          "    payload jsonb NOT NULL\n" +
                                                          ")",
                                                  arg("tableName", tableName)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_aggregate_id ON {:tableName} (aggregate_id, created_at)",
                            arg("tableName", tableName)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_event_id ON {:tableName} (event_id)",
                            arg("tableName", tableName)));
        log.debug("Ensured events table '{}' exists ({})", tableName, numberOfChanges);
    }

    @Override
    public List<Event<?>> load(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        try {
            var events = jdbi.withHandle(handle -> handle.createQuery(loadAggregateEventsSql)
                                                         .bind("aggregateId", aggregateId)
                                                         .setFetchSize(configuration.queryFetchSize)
                                                         .map(rowMapper)
                                                         .list());
            log.trace("Loaded {} event(s) related to aggregate with id '{}'", events.size(), aggregateId);
            return events;
        } catch (JdbiException | SerializationException e) {
            throw new EventStoreException(msg("Failed to load events related to aggregate with id '{}'", aggregateId), e);
        }
    }

    @Override
    public void save(List<Event<?>> events) {
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            return;
        }
        try {
            jdbi.useTransaction(handle -> {
                var batch = handle.prepareBatch(insertSql);
                events.forEach(event -> batch.bind("eventId", event.eventId().toString())
                                             .bind("aggregateId", event.aggregateId())
                                             .bind("aggregateType", event.aggregateType().toString())
                                             .bind("correlationId", event.correlationId().toString())
                                             .bind("createdAt", event.createdAt())
                                             .bind("payload", serializationRegistry.serializeEventPayload(event))
                                             .add());
                var rowsInserted = Arrays.stream(batch.execute()).sum();
                if (rowsInserted != events.size()) {
                    throw new AppendToStreamException(msg("Expected to append {} event(s) but {} row(s) were inserted", events.size(), rowsInserted));
                }
            });
        } catch (AppendToStreamException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AppendToStreamException(msg("Failed to append {} event(s) to '{}'",
                                                  events.size(),
                                                  configuration.eventsTableName), e);
        }
        log.debug("Appended {} event(s)", events.size());
        notifyAfterSaveHooks(events);
    }

    private void notifyAfterSaveHooks(List<Event<?>> events) {
        events.forEach(event -> afterSaveHooks.forEach(hook -> {
            try {
                hook.afterSave(event);
            } catch (RuntimeException e) {
                log.error(msg("After save hook '{}' failed for event '{}' related to aggregate with id '{}'",
                              hook,
                              event.eventId(),
                              event.aggregateId()), e);
            }
        }));
    }

    @Override
    public PostgresqlEventStore addAfterSaveHook(EventHook hook) {
        afterSaveHooks.add(requireNonNull(hook, "No hook provided"));
        return this;
    }

    @Override
    public List<Event<?>> loadEventsOfType(Collection<EventId> eventIds) {
        requireNonNull(eventIds, "No eventIds provided");
        if (eventIds.isEmpty()) {
            return List.of();
        }
        var eventIdValues = eventIds.stream()
                                    .map(EventId::toString)
                                    .distinct()
                                    .collect(Collectors.toList());
        try {
            return jdbi.withHandle(handle -> handle.createQuery(loadEventsOfTypeSql)
                                                   .bindList("eventIds", eventIdValues)
                                                   .setFetchSize(configuration.queryFetchSize)
                                                   .map(rowMapper)
                                                   .list());
        } catch (JdbiException | SerializationException e) {
            throw new EventStoreException(msg("Failed to load events of type {}", eventIdValues), e);
        }
    }
}
