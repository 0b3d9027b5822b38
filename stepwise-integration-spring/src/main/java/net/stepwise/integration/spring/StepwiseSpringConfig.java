package net.stepwise.integration.spring;

import net.stepwise.adapter.jdbc.lock.PgAdvisoryLock;
import net.stepwise.adapter.jdbc.repo.JdbcMigrationRepository;
import net.stepwise.adapter.jdbc.repo.JdbcSliceRepository;
import net.stepwise.core.spi.ExclusivityLock;
import net.stepwise.core.spi.MigrationRepository;
import net.stepwise.core.spi.SliceRepository;
import net.stepwise.core.spi.TxRunner;
import net.stepwise.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * 저장소/트랜잭션/락 빈. 엔진 서비스 조립은 bootstrap 의 자동 설정이 맡는다.
 */
@Configuration(proxyBeanMethods = false)
public class StepwiseSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public MigrationRepository migrationRepository() {
        return new JdbcMigrationRepository();
    }

    @Bean
    public SliceRepository sliceRepository() {
        return new JdbcSliceRepository();
    }

    @Bean
    public ExclusivityLock exclusivityLock(DataSource ds) {
        return new PgAdvisoryLock(ds);
    }
}
