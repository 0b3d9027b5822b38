package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.exception.ValidationException;
import net.stepwise.core.work.WorkDescriptor;
import net.stepwise.core.work.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;

/**
 * {@code SchemaStatement [sql, statementTimeoutSeconds?]}. DDL 한 문장을 item 하나로 실행한다.
 * 같은 테이블을 건드리는 다른 작업과 겹치지 않도록 enqueue 시 tableName 을 함께 준다.
 */
public final class SchemaStatement implements WorkDescriptor<String> {
    private static final Logger log = LoggerFactory.getLogger(SchemaStatement.class);
    public static final String NAME = "SchemaStatement";
    private static final String DONE = "1";

    private final DataSource ds;
    private final String sql;
    private final long timeoutSeconds;

    public SchemaStatement(DataSource ds, String sql, long timeoutSeconds) {
        if (sql == null || sql.isBlank()) throw new ValidationException("schema statement is empty");
        if (timeoutSeconds < 0) throw new ValidationException("statementTimeoutSeconds must not be negative");
        this.ds = ds;
        this.sql = sql;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public Iterator<WorkItem<String>> produceItems(String cursor) {
        if (cursor != null) return Collections.emptyIterator();
        return List.of(new WorkItem<>(sql, DONE)).iterator();
    }

    @Override
    public void process(String statement) throws SQLException {
        try (Connection c = ds.getConnection(); var st = c.createStatement()) {
            c.setAutoCommit(true);
            st.execute("SET statement_timeout = " + (timeoutSeconds * 1000));
            try {
                log.info("Executing schema statement: {}", statement);
                st.execute(statement);
            } finally {
                st.execute("RESET statement_timeout");
            }
        }
    }

    @Override
    public OptionalLong estimateCount() { return OptionalLong.of(1); }
}
