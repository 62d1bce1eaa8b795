package dk.cloudcreate.cqrs.aggregates;

import dk.cloudcreate.cqrs.aggregates.repository.Repository;
import dk.cloudcreate.essentials.shared.reflection.Reflector;
import org.objenesis.*;
import org.objenesis.instantiator.ObjectInstantiator;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Factory that the {@link Repository} uses to create an empty (zero value) instance of an {@link AggregateRoot}
 * before replaying its events.
 *
 * @see #defaultConstructor(Class)
 * @see #objenesis(Class)
 */
@FunctionalInterface
public interface AggregateRootFactory {
    /**
     * @return a new, empty, aggregate root instance without identity
     */
    AggregateRoot create();

    /**
     * An {@link AggregateRootFactory} that calls the default no-arguments constructor on the concrete aggregate type
     *
     * @param aggregateRootType the concrete aggregate type
     */
    static AggregateRootFactory defaultConstructor(Class<? extends AggregateRoot> aggregateRootType) {
        requireNonNull(aggregateRootType, "You must provide an aggregateRootType");
        var reflector = Reflector.reflectOn(aggregateRootType);
        return () -> reflector.newInstance();
    }

    /**
     * An {@link AggregateRootFactory} that uses {@link Objenesis} to create the aggregate instance<br>
     * <b>Please note: Objenesis doesn't initialize fields nor call any constructors</b>, so the aggregate
     * design needs to take this into consideration. {@link AbstractAggregateRoot} has been prepared for it.
     *
     * @param aggregateRootType the concrete aggregate type
     */
    static AggregateRootFactory objenesis(Class<? extends AggregateRoot> aggregateRootType) {
        requireNonNull(aggregateRootType, "You must provide an aggregateRootType");
        ObjectInstantiator<? extends AggregateRoot> instantiator = new ObjenesisStd().getInstantiatorOf(aggregateRootType);
        return instantiator::newInstance;
    }
}
