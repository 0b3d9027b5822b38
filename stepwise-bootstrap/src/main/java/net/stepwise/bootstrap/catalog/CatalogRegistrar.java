package net.stepwise.bootstrap.catalog;

import net.stepwise.bootstrap.props.StepwiseProperties;
import net.stepwise.core.model.Migration;
import net.stepwise.core.service.EnqueueOptions;
import net.stepwise.core.service.MigrationService;
import net.stepwise.core.work.MigrationArguments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 설정에 선언된 마이그레이션을 기동 시 enqueue 한다. enqueue 가 멱등이므로 재기동해도 행이 늘지 않는다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final MigrationService service;

    public CatalogRegistrar(MigrationService service) {
        this.service = service;
    }

    public List<Migration> register(StepwiseProperties.Catalog catalog) throws Exception {
        List<Migration> all = new ArrayList<>();
        for (var def : catalog.getMigrations()) {
            all.addAll(enqueue(def));
        }
        return all;
    }

    private List<Migration> enqueue(StepwiseProperties.MigrationDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank()) {
            throw new IllegalArgumentException("migration.name is required");
        }
        var options = EnqueueOptions.defaults()
                .withShards(def.getShards())
                .withConnectionName(def.getConnectionName())
                .withTableName(def.getTableName())
                .withMaxAttempts(def.getMaxAttempts())
                .withIterationPause(def.getIterationPause())
                .withDelayed(def.isDelayed());

        List<Migration> rows = service.enqueue(def.getName(), MigrationArguments.parse(def.getArguments()), options);
        log.info("Catalog registered: migration='{}' arguments={} rows={}", def.getName(), def.getArguments(), rows.size());
        return rows;
    }
}
