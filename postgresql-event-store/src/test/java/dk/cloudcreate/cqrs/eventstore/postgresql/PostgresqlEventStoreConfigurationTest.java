package dk.cloudcreate.cqrs.eventstore.postgresql;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class PostgresqlEventStoreConfigurationTest {
    @Test
    void standard_configuration_uses_the_events_table() {
        // When
        var configuration = PostgresqlEventStoreConfiguration.standardConfiguration();

        // Then
        assertThat(configuration.eventsTableName).isEqualTo("events");
        assertThat(configuration.queryFetchSize).isEqualTo(PostgresqlEventStoreConfiguration.DEFAULT_QUERY_FETCH_SIZE);
    }

    @Test
    void table_names_are_lower_cased() {
        assertThat(PostgresqlEventStoreConfiguration.usingTable("User_Events").eventsTableName).isEqualTo("user_events");
    }

    @Test
    void table_names_that_arent_plain_identifiers_are_rejected() {
        assertThatThrownBy(() -> PostgresqlEventStoreConfiguration.usingTable("events; DROP TABLE users"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PostgresqlEventStoreConfiguration("events", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
