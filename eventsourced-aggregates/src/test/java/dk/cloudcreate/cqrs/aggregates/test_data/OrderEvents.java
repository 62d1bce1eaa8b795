package dk.cloudcreate.cqrs.aggregates.test_data;

import dk.cloudcreate.cqrs.aggregates.event.EventPayload;
import dk.cloudcreate.cqrs.common.types.EventId;

import java.util.Objects;

public final class OrderEvents {
    public static final EventId ORDER_ADDED   = EventId.of("order.added");
    public static final EventId PRODUCT_ADDED = EventId.of("order.product.added");
    public static final EventId ACCEPTED      = EventId.of("order.accepted");

    private OrderEvents() {
    }

    public static class OrderAdded implements EventPayload {
        private String customerId;

        public OrderAdded() {
        }

        public OrderAdded(String customerId) {
            this.customerId = customerId;
        }

        public String getCustomerId() {
            return customerId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            OrderAdded that = (OrderAdded) o;
            return Objects.equals(customerId, that.customerId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(customerId);
        }

        @Override
        public String toString() {
            return "OrderAdded{" + "customerId=" + customerId + "}";
        }
    }

    public static class ProductAddedToOrder implements EventPayload {
        private String productId;
        private int    quantity;

        public ProductAddedToOrder() {
        }

        public ProductAddedToOrder(String productId, int quantity) {
            this.productId = productId;
            this.quantity = quantity;
        }

        public String getProductId() {
            return productId;
        }

        public int getQuantity() {
            return quantity;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ProductAddedToOrder that = (ProductAddedToOrder) o;
            return Objects.equals(productId, that.productId) && quantity == that.quantity;
        }

        @Override
        public int hashCode() {
            return Objects.hash(productId, quantity);
        }

        @Override
        public String toString() {
            return "ProductAddedToOrder{" + "productId=" + productId + ", " + "quantity=" + quantity + "}";
        }
    }

    public static class OrderAccepted implements EventPayload {
        public OrderAccepted() {
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return OrderAccepted.class.hashCode();
        }

        @Override
        public String toString() {
            return "OrderAccepted{}";
        }
    }

    /**
     * Not supported by {@link Order}
     */
    public static class OrderCancelled implements EventPayload {
        private String reason;

        public OrderCancelled() {
        }

        public OrderCancelled(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            OrderCancelled that = (OrderCancelled) o;
            return Objects.equals(reason, that.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(reason);
        }

        @Override
        public String toString() {
            return "OrderCancelled{" + "reason=" + reason + "}";
        }
    }
}
