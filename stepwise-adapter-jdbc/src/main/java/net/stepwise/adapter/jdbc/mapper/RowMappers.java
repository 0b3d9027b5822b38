package net.stepwise.adapter.jdbc.mapper;

import net.stepwise.adapter.jdbc.JdbcUtil;
import net.stepwise.core.model.ErrorInfo;
import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.model.SliceRun;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Migration ---
    public static Migration toMigration(ResultSet rs) throws SQLException {
        String errorClass = rs.getString("ERROR_CLASS");
        ErrorInfo error = errorClass == null ? null
                : new ErrorInfo(errorClass, rs.getString("ERROR_MESSAGE"), rs.getString("BACKTRACE"));
        return new Migration(
                rs.getLong("ID"),
                rs.getString("MIGRATION_NAME"),
                rs.getString("ARGUMENTS"),
                rs.getString("SHARD"),
                rs.getString("CONNECTION_NAME"),
                rs.getString("TABLE_NAME"),
                MigrationStatus.from(rs.getString("STATUS")),
                rs.getString("CURSOR_VALUE"),
                rs.getLong("PROCESSED_COUNT"),
                JdbcUtil.getNullableLong(rs, "ESTIMATED_TOTAL"),
                rs.getInt("ATTEMPTS"),
                rs.getInt("MAX_ATTEMPTS"),
                JdbcUtil.millis(rs, "ITERATION_PAUSE_MS"),
                error,
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT"))
        );
    }

    // --- Slice ---
    public static SliceRun toSliceRun(ResultSet rs) throws SQLException {
        return new SliceRun(
                rs.getLong("ID"),
                rs.getLong("MIGRATION_ID"),
                rs.getLong("MIN_VALUE"),
                rs.getLong("MAX_VALUE"),
                SliceRun.Status.from(rs.getString("STATUS")),
                rs.getInt("ATTEMPTS"),
                rs.getString("ERROR_CLASS"),
                rs.getString("ERROR_MESSAGE"),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("FINISHED_AT")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
