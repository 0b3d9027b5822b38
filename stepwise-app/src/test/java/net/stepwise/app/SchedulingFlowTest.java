package net.stepwise.app;

import net.stepwise.core.model.Migration;
import net.stepwise.core.model.MigrationStatus;
import net.stepwise.core.service.EnqueueOptions;
import net.stepwise.core.service.MigrationService;
import net.stepwise.core.work.MigrationArguments;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class SchedulingFlowTest {

    private static final String BACKFILL_ARGS =
            "[\"app_users\",\"status\",\"active\",{\"batchSize\":25,\"subBatchSize\":10,\"subBatchPauseMs\":0}]";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        // Boot DataSource & Flyway가 Testcontainers DB로 붙도록
        r.add("spring.datasource.url", postgres::getJdbcUrl);
        r.add("spring.datasource.username", postgres::getUsername);
        r.add("spring.datasource.password", postgres::getPassword);
        r.add("spring.flyway.locations", () -> "classpath:db/migration/postgresql,classpath:db/testdata");
        r.add("stepwise.scheduler.tick-delay-ms", () -> "300");
        r.add("stepwise.scheduler.max-concurrency", () -> "2");
        // 기동 시 카탈로그가 백필 하나를 enqueue
        r.add("stepwise.catalog.migrations[0].name", () -> "BackfillColumn");
        r.add("stepwise.catalog.migrations[0].arguments", () -> BACKFILL_ARGS);
    }

    @Autowired JdbcTemplate jdbc;
    @Autowired MigrationService service;

    @Test
    void catalog_backfill_is_scheduled_and_completes() throws Exception {
        var args = MigrationArguments.parse(BACKFILL_ARGS);

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> {
            var group = service.inspectGroup("BackfillColumn", args);
            assertThat(group.children()).hasSize(1);
            assertThat(group.status()).isEqualTo(MigrationStatus.SUCCEEDED);
            assertThat(group.percent().getAsDouble()).isEqualTo(100.0);
        });

        assertThat(jdbc.queryForObject("SELECT count(*) FROM app_users WHERE status = 'active'", Long.class))
                .isEqualTo(120L);
        Migration m = service.inspectGroup("BackfillColumn", args).children().get(0).migration();
        assertThat(m.processedCount()).isEqualTo(5L);
        assertThat(m.finishedAt()).isNotNull();
        assertThat(jdbc.queryForObject("SELECT count(*) FROM TB_MIGRATION_SLICE WHERE MIGRATION_ID = ? AND STATUS = 'SUCCEEDED'",
                Long.class, m.id())).isEqualTo(5L);
    }

    @Test
    void delayed_schema_statement_waits_for_approval() throws Exception {
        var args = MigrationArguments.of("ALTER TABLE app_users ADD COLUMN IF NOT EXISTS nickname VARCHAR(64)");
        List<Migration> rows = service.enqueue("SchemaStatement", args,
                EnqueueOptions.defaults().withTableName("app_users").withDelayed(true));
        long id = rows.get(0).id();

        // 몇 틱이 지나도 승인 전에는 그대로
        Thread.sleep(1000);
        assertThat(service.inspect(id).migration().status()).isEqualTo(MigrationStatus.DELAYED);

        assertThat(service.approve(id)).isTrue();

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() ->
                assertThat(service.inspect(id).migration().status()).isEqualTo(MigrationStatus.SUCCEEDED));
        assertThat(jdbc.queryForObject(
                "SELECT count(*) FROM information_schema.columns WHERE table_name = 'app_users' AND column_name = 'nickname'",
                Long.class)).isEqualTo(1L);
    }
}
