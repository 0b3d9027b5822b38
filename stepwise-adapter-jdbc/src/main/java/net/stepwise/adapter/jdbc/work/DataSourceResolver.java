package net.stepwise.adapter.jdbc.work;

import net.stepwise.core.exception.ValidationException;

import javax.sql.DataSource;
import java.util.Map;

/** connectionName -> 작업 대상 DataSource. null 이름은 기본 커넥션이다. */
@FunctionalInterface
public interface DataSourceResolver {
    DataSource resolve(String connectionName);

    static DataSourceResolver single(DataSource ds) {
        return name -> ds;
    }

    static DataSourceResolver of(DataSource defaultDs, Map<String, DataSource> named) {
        Map<String, DataSource> copy = Map.copyOf(named);
        return name -> {
            if (name == null) return defaultDs;
            DataSource ds = copy.get(name);
            if (ds == null) throw new ValidationException("Unknown connection '" + name + "'");
            return ds;
        };
    }
}
