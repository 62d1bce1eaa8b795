package dk.cloudcreate.cqrs.eventstore.postgresql;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jdbi {@link SqlLogger} that reports the SQL executed by the {@link PostgresqlEventStore} on the <code>EventStore.Sql</code> logger
 */
class EventStoreSqlLogger implements SqlLogger {
    private static final Logger log = LoggerFactory.getLogger("EventStore.Sql");

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Executed in {} ms: {}", Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(), context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        log.error(msg("Failed after {} ms: {}", Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(), context.getRenderedSql()), ex);
    }
}
