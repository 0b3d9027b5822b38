package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.spi.Sleeper;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * {@code DeleteOrphanedRecords [table, foreignKey, parentTable, options?]}.
 * 부모 쪽 키는 options 의 keyColumn 과 같은 이름으로 본다.
 */
public final class DeleteOrphanedRecords extends JdbcRangeWorkDescriptor {
    public static final String NAME = "DeleteOrphanedRecords";

    private final String foreignKey;
    private final String parentTable;

    public DeleteOrphanedRecords(DataSource ds, String table, String foreignKey, String parentTable,
                                 RangeOptions options, Sleeper sleeper) {
        super(ds, table, options, sleeper);
        this.foreignKey = SqlIdentifiers.require("foreign key", foreignKey);
        this.parentTable = SqlIdentifiers.require("parent table", parentTable);
    }

    @Override
    protected String sql() {
        return "DELETE FROM " + table + " c"
                + " WHERE c." + keyColumn + " BETWEEN ? AND ?"
                + " AND c." + foreignKey + " IS NOT NULL"
                + " AND NOT EXISTS (SELECT 1 FROM " + parentTable + " p WHERE p." + keyColumn + " = c." + foreignKey + ")";
    }

    @Override
    protected void bind(PreparedStatement ps, long low, long high) throws SQLException {
        ps.setLong(1, low);
        ps.setLong(2, high);
    }
}
