package dk.cloudcreate.cqrs.eventstore.postgresql;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of the {@link PostgresqlEventStore}
 */
public class PostgresqlEventStoreConfiguration {
    public static final String DEFAULT_EVENTS_TABLE_NAME = "events";
    public static final int    DEFAULT_QUERY_FETCH_SIZE  = 100;

    /**
     * The name of the table all events are stored in
     */
    public final String eventsTableName;
    /**
     * The JDBC fetch size used when loading events
     */
    public final int    queryFetchSize;

    public PostgresqlEventStoreConfiguration(String eventsTableName, int queryFetchSize) {
        this.eventsTableName = requireNonNull(eventsTableName, "No eventsTableName provided").toLowerCase();
        requireTrue(this.eventsTableName.matches("[a-z_][a-z0-9_]*"), msg("Invalid eventsTableName '{}'", eventsTableName));
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
    }

    public static PostgresqlEventStoreConfiguration standardConfiguration() {
        return new PostgresqlEventStoreConfiguration(DEFAULT_EVENTS_TABLE_NAME, DEFAULT_QUERY_FETCH_SIZE);
    }

    public static PostgresqlEventStoreConfiguration usingTable(String eventsTableName) {
        return new PostgresqlEventStoreConfiguration(eventsTableName, DEFAULT_QUERY_FETCH_SIZE);
    }

    @Override
    public String toString() {
        return "PostgresqlEventStoreConfiguration{" +
                "eventsTableName='" + eventsTableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                '}';
    }
}
