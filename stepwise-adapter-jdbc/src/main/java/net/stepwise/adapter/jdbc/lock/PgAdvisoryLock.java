package net.stepwise.adapter.jdbc.lock;

import net.stepwise.core.spi.ExclusivityLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.zip.CRC32;

/**
 * PostgreSQL 세션 advisory 락. 트랜잭션과 분리된 전용 커넥션에서 잡고 body 가 끝나면 푼다.
 */
public final class PgAdvisoryLock implements ExclusivityLock {
    private static final Logger log = LoggerFactory.getLogger(PgAdvisoryLock.class);
    private static final long SALT = 936_723_412L;

    private final DataSource ds;

    public PgAdvisoryLock(DataSource ds) { this.ds = ds; }

    @Override
    public <T> Optional<T> tryWithLock(String name, Callable<T> body) throws Exception {
        long key = keyOf(name);
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(true);
            if (!tryLock(c, key)) {
                log.debug("Advisory lock '{}' ({}) is held by another session", name, key);
                return Optional.empty();
            }
            try {
                return Optional.ofNullable(body.call());
            } finally {
                if (!unlock(c, key)) {
                    log.warn("Advisory lock '{}' ({}) was not held at unlock", name, key);
                }
            }
        }
    }

    public static long keyOf(String name) {
        CRC32 crc = new CRC32();
        crc.update(name.getBytes(StandardCharsets.UTF_8));
        return SALT * crc.getValue();
    }

    private static boolean tryLock(Connection c, long key) throws SQLException {
        try (var ps = c.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            ps.setLong(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static boolean unlock(Connection c, long key) throws SQLException {
        try (var ps = c.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            ps.setLong(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }
}
