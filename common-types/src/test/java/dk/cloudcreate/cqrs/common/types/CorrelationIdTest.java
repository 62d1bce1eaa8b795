package dk.cloudcreate.cqrs.common.types;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdTest {
    @Test
    void test_random_creates_a_uuid_based_correlation_id() {
        // When
        var correlationId = CorrelationId.random();

        // Then
        assertThat(UUID.fromString(correlationId.toString()).toString()).isEqualTo(correlationId.toString());
    }

    @Test
    void test_two_random_correlation_ids_are_not_equal() {
        // When
        var first  = CorrelationId.random();
        var second = CorrelationId.random();

        // Then
        assertThat(first.equals(second)).isFalse();
        assertThat((CharSequence) first).isNotEqualTo(second);
    }

    @Test
    void test_creating_a_CorrelationId_from_a_String_value() {
        // Given
        var value = "c1";

        // When
        var correlationId = CorrelationId.of(value);

        // Then
        assertThat(correlationId.toString()).isEqualTo(value);
        assertThat(correlationId.equals(CorrelationId.of("c1"))).isTrue();
        assertThat((CharSequence) correlationId).isEqualTo(CorrelationId.of(value));
    }

    @Test
    void test_identifiers_of_different_kinds_with_same_value_keep_their_value() {
        // When
        var commandId = CommandId.of("user.create");
        var eventId   = EventId.of("user.created");
        var type      = AggregateType.of("user");

        // Then
        assertThat(commandId.toString()).isEqualTo("user.create");
        assertThat(eventId.toString()).isEqualTo("user.created");
        assertThat(type.toString()).isEqualTo("user");
        assertThat(eventId.equals(EventId.of("user.email.changed"))).isFalse();
    }
}
