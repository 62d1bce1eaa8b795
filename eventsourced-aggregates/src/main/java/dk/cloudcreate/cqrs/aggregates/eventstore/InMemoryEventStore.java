package dk.cloudcreate.cqrs.aggregates.eventstore;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.common.types.EventId;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps all events in memory. Intended for tests and single process setups.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private static final Comparator<Event<?>> CREATION_ORDER = Comparator.comparing(Event::createdAt);

    private final ReadWriteLock                 lock               = new ReentrantReadWriteLock();
    private final Map<String, List<Event<?>>>   eventsPerAggregate = new HashMap<>();
    private final List<Event<?>>                allEvents          = new ArrayList<>();
    private final List<EventHook>               afterSaveHooks     = new CopyOnWriteArrayList<>();

    @Override
    public List<Event<?>> load(String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        List<Event<?>> events;
        lock.readLock().lock();
        try {
            events = new ArrayList<>(eventsPerAggregate.getOrDefault(aggregateId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
        events.sort(CREATION_ORDER);
        log.trace("Loaded {} event(s) related to aggregate with id '{}'", events.size(), aggregateId);
        return events;
    }

    @Override
    public void save(List<Event<?>> events) {
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            return;
        }
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i) == null) {
                throw new AppendToStreamException(msg("Failed to append {} event(s): event at index {} is null", events.size(), i));
            }
        }

        lock.writeLock().lock();
        try {
            events.forEach(event -> {
                eventsPerAggregate.computeIfAbsent(event.aggregateId(), aggregateId -> new ArrayList<>()).add(event);
                allEvents.add(event);
            });
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Saved {} event(s)", events.size());
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
    public InMemoryEventStore addAfterSaveHook(EventHook hook) {
        afterSaveHooks.add(requireNonNull(hook, "No hook provided"));
        return this;
    }

    @Override
    public List<Event<?>> loadEventsOfType(Collection<EventId> eventIds) {
        requireNonNull(eventIds, "No eventIds provided");
        var includedEventIds = Set.copyOf(eventIds);
        List<Event<?>> events;
        lock.readLock().lock();
        try {
            events = allEvents.stream()
                              .filter(event -> includedEventIds.contains(event.eventId()))
                              .collect(Collectors.toCollection(ArrayList::new));
        } finally {
            lock.readLock().unlock();
        }
        events.sort(CREATION_ORDER);
        return events;
    }
}
