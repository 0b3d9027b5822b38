package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.spi.Sleeper;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/** {@code CopyColumn [table, fromColumn, toColumn, options?]} */
public final class CopyColumn extends JdbcRangeWorkDescriptor {
    public static final String NAME = "CopyColumn";

    private final String from;
    private final String to;

    public CopyColumn(DataSource ds, String table, String from, String to, RangeOptions options, Sleeper sleeper) {
        super(ds, table, options, sleeper);
        this.from = SqlIdentifiers.require("source column", from);
        this.to = SqlIdentifiers.require("target column", to);
    }

    @Override
    protected String sql() {
        return "UPDATE " + table + " SET " + to + " = " + from
                + " WHERE " + keyColumn + " BETWEEN ? AND ? AND " + to + " IS DISTINCT FROM " + from;
    }

    @Override
    protected void bind(PreparedStatement ps, long low, long high) throws SQLException {
        ps.setLong(1, low);
        ps.setLong(2, high);
    }
}
