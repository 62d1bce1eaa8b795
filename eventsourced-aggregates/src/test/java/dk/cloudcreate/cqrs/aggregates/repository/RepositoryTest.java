package dk.cloudcreate.cqrs.aggregates.repository;

import dk.cloudcreate.cqrs.aggregates.AggregateRootFactory;
import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.eventstore.EventStoreException;
import dk.cloudcreate.cqrs.aggregates.test_data.*;
import dk.cloudcreate.cqrs.aggregates.test_data.OrderCommands.*;
import dk.cloudcreate.cqrs.common.types.*;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class RepositoryTest {
    private FailingEventStore eventStore;
    private Repository        repository;

    @BeforeEach
    void setup() {
        eventStore = new FailingEventStore();
        repository = Repository.from(eventStore)
                               .registerAggregateRootFactory(OrderCommands.ORDERS, AggregateRootFactory.defaultConstructor(Order.class));
    }

    @Test
    void loading_an_unregistered_aggregate_type_fails() {
        assertThatThrownBy(() -> repository.load(AggregateType.of("invoice"), "a1"))
                .isExactlyInstanceOf(UnknownAggregateTypeException.class)
                .hasMessageContaining("invoice");
    }

    @Test
    void loading_with_an_empty_id_returns_an_empty_aggregate_without_reading_the_store() {
        // Given
        eventStore.failLoad.set(true);

        // When
        var aggregateRoot = repository.load(OrderCommands.ORDERS, "");

        // Then
        assertThat(aggregateRoot).isExactlyInstanceOf(Order.class);
        assertThat(aggregateRoot.hasIdentity()).isFalse();
        assertThat(eventStore.loadCounter.get()).isEqualTo(0);
    }

    @Test
    void loading_an_unknown_id_returns_an_empty_aggregate() {
        // When
        var aggregateRoot = repository.load(OrderCommands.ORDERS, "unknown");

        // Then
        assertThat(aggregateRoot.hasIdentity()).isFalse();
        assertThat(eventStore.loadCounter.get()).isEqualTo(1);
    }

    @Test
    void a_saved_aggregate_is_loaded_by_replaying_its_events() {
        // Given
        var order = new Order();
        order.handleCommand(Command.creating(OrderCommands.ADD_ORDER, OrderCommands.ORDERS, CorrelationId.of("c1"), new AddOrder("customer-1")));
        order.handleCommand(Command.of(OrderCommands.ADD_PRODUCT, OrderCommands.ORDERS, order.aggregateId(), CorrelationId.of("c2"), new AddProduct("p1", 3)));

        // When
        repository.save(order);
        var loaded = (Order) repository.load(OrderCommands.ORDERS, order.aggregateId());

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(loaded.aggregateId()).isEqualTo(order.aggregateId());
        assertThat(loaded.customerId).isEqualTo("customer-1");
        assertThat(loaded.productAndQuantity).containsEntry("p1", 3);
        assertThat(loaded.uncommittedChanges()).isEmpty();
    }

    @Test
    void each_load_returns_a_fresh_instance() {
        // Given
        var order = new Order();
        order.handleCommand(Command.creating(OrderCommands.ADD_ORDER, OrderCommands.ORDERS, CorrelationId.of("c1"), new AddOrder("customer-1")));
        repository.save(order);

        // When
        var first  = repository.load(OrderCommands.ORDERS, order.aggregateId());
        var second = repository.load(OrderCommands.ORDERS, order.aggregateId());

        // Then
        assertThat(first).isNotSameAs(second);
        assertThat(eventStore.loadCounter.get()).isEqualTo(2);
    }

    @Test
    void a_failed_save_keeps_the_uncommitted_changes() {
        // Given
        var order = new Order();
        order.handleCommand(Command.creating(OrderCommands.ADD_ORDER, OrderCommands.ORDERS, CorrelationId.of("c1"), new AddOrder("customer-1")));
        eventStore.failSave.set(true);

        // When / Then
        assertThatThrownBy(() -> repository.save(order))
                .isInstanceOf(EventStoreException.class);
        assertThat(order.uncommittedChanges()).hasSize(1);

        // And When
        eventStore.failSave.set(false);
        repository.save(order);

        // Then
        assertThat(order.uncommittedChanges()).isEmpty();
        assertThat(eventStore.delegate.load(order.aggregateId())).hasSize(1);
    }

    @Test
    void saving_an_aggregate_without_changes_is_a_no_op() {
        // Given
        eventStore.failSave.set(true);

        // When / Then
        assertThatCode(() -> repository.save(new Order())).doesNotThrowAnyException();
    }

    @Test
    void registering_a_factory_again_replaces_the_previous_one() {
        // When
        repository.registerAggregateRootFactory(OrderCommands.ORDERS, AggregateRootFactory.defaultConstructor(BrokenOrder.class));

        // Then
        assertThat(repository.load(OrderCommands.ORDERS, "")).isExactlyInstanceOf(BrokenOrder.class);
    }
}
