package dk.cloudcreate.cqrs.aggregates.test_data;

import dk.cloudcreate.cqrs.aggregates.AggregateRoot;
import dk.cloudcreate.cqrs.aggregates.command.*;
import dk.cloudcreate.cqrs.common.types.*;

import java.util.Objects;

public final class OrderCommands {
    public static final AggregateType ORDERS = AggregateType.of("order");

    public static final CommandId ADD_ORDER   = CommandId.of("order.add");
    public static final CommandId ADD_PRODUCT = CommandId.of("order.product.add");
    public static final CommandId ACCEPT      = CommandId.of("order.accept");

    private OrderCommands() {
    }

    public static class AddOrder implements CommandPayload {
        private String customerId;

        public AddOrder() {
        }

        public AddOrder(String customerId) {
            this.customerId = customerId;
        }

        public String getCustomerId() {
            return customerId;
        }

        @Override
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            if (aggregateRoot.hasIdentity()) {
                throw new CommandValidationException("Order already exists");
            }
            if (customerId == null || customerId.isBlank()) {
                throw new CommandValidationException("No customerId provided");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AddOrder that = (AddOrder) o;
            return Objects.equals(customerId, that.customerId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(customerId);
        }

        @Override
        public String toString() {
            return "AddOrder{" + "customerId=" + customerId + "}";
        }
    }

    public static class AddProduct implements CommandPayload {
        private String productId;
        private int    quantity;

        public AddProduct() {
        }

        public AddProduct(String productId, int quantity) {
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
        public void validate(Command<?> command, AggregateRoot aggregateRoot) {
            if (!aggregateRoot.hasIdentity()) {
                throw new CommandValidationException("Order doesn't exist");
            }
            if (quantity <= 0) {
                throw new CommandValidationException("Quantity must be positive");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AddProduct that = (AddProduct) o;
            return Objects.equals(productId, that.productId) && quantity == that.quantity;
        }

        @Override
        public int hashCode() {
            return Objects.hash(productId, quantity);
        }

        @Override
        public String toString() {
            return "AddProduct{" + "productId=" + productId + ", " + "quantity=" + quantity + "}";
        }
    }

    public static class AcceptOrder implements CommandPayload {
        public AcceptOrder() {
        }

        @Override
        public boolean equals(Object o) {
            return o != null && getClass() == o.getClass();
        }

        @Override
        public int hashCode() {
            return AcceptOrder.class.hashCode();
        }

        @Override
        public String toString() {
            return "AcceptOrder{}";
        }
    }

    /**
     * Not supported by {@link Order}
     */
    public static class CancelOrder implements CommandPayload {
        private String reason;

        public CancelOrder() {
        }

        public CancelOrder(String reason) {
            this.reason = reason;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            CancelOrder that = (CancelOrder) o;
            return Objects.equals(reason, that.reason);
        }

        @Override
        public int hashCode() {
            return Objects.hash(reason);
        }

        @Override
        public String toString() {
            return "CancelOrder{" + "reason=" + reason + "}";
        }
    }
}
