package net.stepwise.adapter.jdbc.work;

import com.fasterxml.jackson.databind.JsonNode;
import net.stepwise.core.spi.Sleeper;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;

/**
 * {@code BackfillColumn [table, column, value, options?]}. 이미 값이 같은 행은 건드리지 않는다.
 */
public final class BackfillColumn extends JdbcRangeWorkDescriptor {
    public static final String NAME = "BackfillColumn";

    private final String column;
    private final JsonNode value;

    public BackfillColumn(DataSource ds, String table, String column, JsonNode value, RangeOptions options, Sleeper sleeper) {
        super(ds, table, options, sleeper);
        this.column = SqlIdentifiers.require("column", column);
        this.value = value;
    }

    @Override
    protected String sql() {
        if (value.isNull()) {
            return "UPDATE " + table + " SET " + column + " = NULL"
                    + " WHERE " + keyColumn + " BETWEEN ? AND ? AND " + column + " IS NOT NULL";
        }
        return "UPDATE " + table + " SET " + column + " = ?"
                + " WHERE " + keyColumn + " BETWEEN ? AND ? AND " + column + " IS DISTINCT FROM ?";
    }

    @Override
    protected void bind(PreparedStatement ps, long low, long high) throws SQLException {
        if (value.isNull()) {
            ps.setLong(1, low);
            ps.setLong(2, high);
            return;
        }
        bindValue(ps, 1);
        ps.setLong(2, low);
        ps.setLong(3, high);
        bindValue(ps, 4);
    }

    private void bindValue(PreparedStatement ps, int idx) throws SQLException {
        if (value.isBoolean()) {
            ps.setBoolean(idx, value.booleanValue());
        } else if (value.isIntegralNumber()) {
            ps.setLong(idx, value.longValue());
        } else if (value.isNumber()) {
            ps.setBigDecimal(idx, value.decimalValue());
        } else {
            // 타입 추론은 서버에 맡긴다
            ps.setObject(idx, value.asText(), Types.OTHER);
        }
    }
}
