package dk.cloudcreate.cqrs.aggregates.eventstore;

import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.common.types.EventId;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link EventHook} for projections that are built from the existing history of an {@link EventStore} and then kept current.
 * <p>
 * {@link #catchUp(EventStore, Collection)} registers the hook <b>before</b> loading the history. Events saved while the history
 * is being loaded are buffered and projected after it, skipping those the history already contained, so every event
 * is projected exactly once and none is lost between the load and the registration.
 */
public abstract class CatchingUpEventHook implements EventHook {
    private static final Logger log = LoggerFactory.getLogger(CatchingUpEventHook.class);

    private final Object         lock = new Object();
    /**
     * Events received while catching up. <code>null</code> when not catching up
     */
    private       List<Event<?>> eventsReceivedWhileCatchingUp;

    /**
     * Register this hook with the <code>eventStore</code> and project every persisted event with one of the <code>eventIds</code>
     *
     * @param eventStore the event store to catch up with
     * @param eventIds   the event identifiers the projection is built from
     * @return the number of events projected while catching up
     */
    protected int catchUp(EventStore eventStore, Collection<EventId> eventIds) {
        requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(eventIds, "No eventIds provided");
        synchronized (lock) {
            eventsReceivedWhileCatchingUp = new ArrayList<>();
        }
        eventStore.addAfterSaveHook(this);
        List<Event<?>> history;
        try {
            history = eventStore.loadEventsOfType(eventIds);
        } catch (RuntimeException e) {
            synchronized (lock) {
                eventsReceivedWhileCatchingUp = null;
            }
            throw e;
        }
        synchronized (lock) {
            history.forEach(this::project);
            var alreadyProjected = new HashSet<Event<?>>(history);
            var projected        = history.size();
            for (var event : eventsReceivedWhileCatchingUp) {
                if (alreadyProjected.add(event)) {
                    project(event);
                    projected++;
                }
            }
            log.debug("[{}] Caught up with {} historic event(s) and {} event(s) saved meanwhile",
                      getClass().getSimpleName(),
                      history.size(),
                      projected - history.size());
            eventsReceivedWhileCatchingUp = null;
            return projected;
        }
    }

    @Override
    public final void afterSave(Event<?> event) {
        synchronized (lock) {
            if (eventsReceivedWhileCatchingUp != null) {
                eventsReceivedWhileCatchingUp.add(event);
                return;
            }
            project(event);
        }
    }

    /**
     * Apply the event to the projection. Called with the hook's lock held, one event at a time
     */
    protected abstract void project(Event<?> event);
}
