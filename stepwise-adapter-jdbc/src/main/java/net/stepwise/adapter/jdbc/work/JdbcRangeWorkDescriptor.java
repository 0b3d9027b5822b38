package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.spi.Sleeper;
import net.stepwise.core.work.RangeWorkDescriptor;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * 숫자 키 컬럼의 [MIN, MAX] 를 도메인으로 하는 집합 기반 SQL 작업.
 * 서브배치마다 autocommit 커넥션에서 한 문장을 실행한다.
 */
public abstract class JdbcRangeWorkDescriptor extends RangeWorkDescriptor {
    protected final DataSource ds;
    protected final String table;
    protected final String keyColumn;

    protected JdbcRangeWorkDescriptor(DataSource ds, String table, RangeOptions options, Sleeper sleeper) {
        super(options.batchSize(), options.subBatchSize(), options.subBatchPause(), sleeper);
        this.ds = ds;
        this.table = SqlIdentifiers.require("table", table);
        this.keyColumn = options.keyColumn();
    }

    @Override
    protected Domain resolveDomain() throws SQLException {
        try (Connection c = ds.getConnection();
             var ps = c.prepareStatement("SELECT MIN(" + keyColumn + "), MAX(" + keyColumn + ") FROM " + table);
             var rs = ps.executeQuery()) {
            if (!rs.next()) return EMPTY;
            long min = rs.getLong(1);
            if (rs.wasNull()) return EMPTY;
            return new Domain(min, rs.getLong(2));
        }
    }

    @Override
    protected void processRange(long low, long high) throws SQLException {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            try (var ps = c.prepareStatement(sql())) {
                bind(ps, low, high);
                ps.executeUpdate();
            }
        }
    }

    /** 서브배치 한 번에 실행할 문장 */
    protected abstract String sql();

    /** 범위 [low, high] 와 나머지 파라미터 바인딩 */
    protected abstract void bind(PreparedStatement ps, long low, long high) throws SQLException;
}
