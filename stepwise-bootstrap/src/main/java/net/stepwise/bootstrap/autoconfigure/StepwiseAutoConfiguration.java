package net.stepwise.bootstrap.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import net.stepwise.adapter.jdbc.work.DataSourceResolver;
import net.stepwise.adapter.jdbc.work.JdbcWorkDescriptors;
import net.stepwise.bootstrap.catalog.CatalogRegistrar;
import net.stepwise.bootstrap.props.StepwiseProperties;
import net.stepwise.core.event.LoggingMigrationEventListener;
import net.stepwise.core.event.MigrationEventListener;
import net.stepwise.core.event.MigrationEvents;
import net.stepwise.core.service.EngineConfig;
import net.stepwise.core.service.MigrationRunner;
import net.stepwise.core.service.MigrationScheduler;
import net.stepwise.core.service.MigrationService;
import net.stepwise.core.service.MigrationWorker;
import net.stepwise.core.spi.Clock;
import net.stepwise.core.spi.ExclusivityLock;
import net.stepwise.core.spi.MigrationErrorHandler;
import net.stepwise.core.spi.MigrationExecutor;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.Sleeper;
import net.stepwise.core.spi.SliceRepository;
import net.stepwise.core.spi.ThrottlePredicate;
import net.stepwise.core.spi.TxRunner;
import net.stepwise.core.work.WorkDescriptorRegistration;
import net.stepwise.core.work.WorkDescriptorRegistry;
import net.stepwise.integration.spring.StepwiseSpringConfig;
import net.stepwise.integration.spring.metrics.MicrometerMigrationEventListener;
import net.stepwise.integration.spring.sched.StepwiseSchedulers;
import net.stepwise.integration.spring.sched.TaskExecutorMigrationExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class})
@EnableConfigurationProperties(StepwiseProperties.class)
@Import(StepwiseSpringConfig.class) // integration-spring: repos/tx/lock wiring
public class StepwiseAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(StepwiseAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public Clock stepwiseClock() {
        return Instant::now;
    }

    @Bean
    @ConditionalOnMissingBean
    public DataSourceResolver dataSourceResolver(DataSource ds) {
        return DataSourceResolver.single(ds);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig engineConfig(StepwiseProperties props,
                                     ObjectProvider<ThrottlePredicate> throttle,
                                     ObjectProvider<MigrationErrorHandler> errorHandler) {
        return props.getEngine().toBuilder()
                .throttlePredicate(throttle.getIfAvailable(() -> ThrottlePredicate.NEVER))
                .errorHandler(errorHandler.getIfAvailable(() -> MigrationErrorHandler.NOOP))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkDescriptorRegistry workDescriptorRegistry(ObjectProvider<WorkDescriptorRegistration> registrations,
                                                         DataSourceResolver resolver) {
        var registry = JdbcWorkDescriptors.registerAll(new WorkDescriptorRegistry(), resolver);
        registrations.orderedStream().forEach(registry::register);
        log.info("Registered work descriptors: {}", registry.names());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationEvents migrationEvents(ObjectProvider<MigrationEventListener> listeners,
                                           ObjectProvider<MeterRegistry> meters,
                                           Clock clock) {
        List<MigrationEventListener> all = new ArrayList<>();
        all.add(new LoggingMigrationEventListener());
        meters.ifAvailable(r -> all.add(new MicrometerMigrationEventListener(r)));
        listeners.orderedStream().forEach(all::add);
        return new MigrationEvents(all, clock);
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public MigrationRunner migrationRunner(MigrationRepository migrations,
                                           SliceRepository slices,
                                           WorkDescriptorRegistry registry,
                                           MigrationEvents events,
                                           TxRunner tx,
                                           Clock clock,
                                           EngineConfig config) {
        return new MigrationRunner(migrations, slices, registry, events, tx, clock, Sleeper.SYSTEM, config);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "stepwiseTaskExecutor")
    public ThreadPoolTaskExecutor stepwiseTaskExecutor(StepwiseProperties props) {
        var pool = new ThreadPoolTaskExecutor();
        int size = Math.max(1, props.getScheduler().getMaxConcurrency());
        pool.setCorePoolSize(size);
        pool.setMaxPoolSize(size);
        pool.setThreadNamePrefix("stepwise-worker-");
        pool.setWaitForTasksToCompleteOnShutdown(false);
        pool.initialize();
        return pool;
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationExecutor migrationExecutor(MigrationRunner runner,
                                               EngineConfig config,
                                               ThreadPoolTaskExecutor stepwiseTaskExecutor) {
        return new TaskExecutorMigrationExecutor(new MigrationWorker(runner, Sleeper.SYSTEM, config), stepwiseTaskExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationScheduler migrationScheduler(MigrationRepository migrations,
                                                 ExclusivityLock lock,
                                                 MigrationExecutor executor,
                                                 MigrationEvents events,
                                                 TxRunner tx,
                                                 Clock clock,
                                                 EngineConfig config) {
        return new MigrationScheduler(migrations, lock, executor, events, tx, clock, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public MigrationService migrationService(MigrationRepository migrations,
                                             WorkDescriptorRegistry registry,
                                             TxRunner tx,
                                             Clock clock,
                                             EngineConfig config) {
        return new MigrationService(migrations, registry, tx, clock, config);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "stepwise.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public StepwiseSchedulers stepwiseSchedulers(MigrationScheduler scheduler, StepwiseProperties props) {
        var s = new StepwiseSchedulers(scheduler);

        // @Scheduled 딜레이는 stepwise.scheduler.tick-delay-ms 에서 읽힘. 나머지만 세터로 주입
        s.setMaxConcurrency(props.getScheduler().getMaxConcurrency());
        s.setShard(props.getScheduler().getShard());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(MigrationService service) {
        return new CatalogRegistrar(service);
    }

    @Bean
    @ConditionalOnProperty(prefix = "stepwise.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, StepwiseProperties props) {
        log.info("Catalog: \n{}", props.getCatalog().getMigrations().stream()
                .map(StepwiseProperties.MigrationDef::toString)
                .collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
