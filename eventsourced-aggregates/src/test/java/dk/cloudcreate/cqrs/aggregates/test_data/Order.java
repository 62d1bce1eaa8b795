package dk.cloudcreate.cqrs.aggregates.test_data;

import dk.cloudcreate.cqrs.aggregates.*;
import dk.cloudcreate.cqrs.aggregates.command.Command;
import dk.cloudcreate.cqrs.aggregates.event.Event;
import dk.cloudcreate.cqrs.aggregates.test_data.OrderCommands.*;
import dk.cloudcreate.cqrs.aggregates.test_data.OrderEvents.*;

import java.util.*;

/**
 * Example Order aggregate for testing {@link AbstractAggregateRoot}, the repository and the command handler
 */
public class Order extends AbstractAggregateRoot {
    public String               customerId;
    public Map<String, Integer> productAndQuantity;
    public boolean              accepted;

    public Order() {
    }

    @Override
    public void handleCommand(Command<?> command) {
        var payload = command.payload();
        if (payload instanceof AddOrder) {
            applyNewEvent(OrderEvents.ORDER_ADDED, command, UUID.randomUUID().toString(), new OrderAdded(((AddOrder) payload).getCustomerId()));
        } else if (payload instanceof AddProduct) {
            var addProduct = (AddProduct) payload;
            applyNewEvent(OrderEvents.PRODUCT_ADDED, command, new ProductAddedToOrder(addProduct.getProductId(), addProduct.getQuantity()));
        } else if (payload instanceof AcceptOrder) {
            if (!accepted) {
                applyNewEvent(OrderEvents.ACCEPTED, command, new OrderAccepted());
            }
        } else {
            throw UnknownCommandException.forCommand(command, this);
        }
    }

    @Override
    protected void applyEventToTheAggregate(Event<?> event) {
        var payload = event.payload();
        if (payload instanceof OrderAdded) {
            customerId = ((OrderAdded) payload).getCustomerId();
            productAndQuantity = new HashMap<>();
        } else if (payload instanceof ProductAddedToOrder) {
            var productAdded = (ProductAddedToOrder) payload;
            productAndQuantity.merge(productAdded.getProductId(), productAdded.getQuantity(), Integer::sum);
        } else if (payload instanceof OrderAccepted) {
            accepted = true;
        } else {
            throw UnknownEventException.forEvent(event, this);
        }
    }
}
