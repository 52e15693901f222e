package com.pipewright.core.persistence;

import com.pipewright.core.idempotency.InMemoryRunStatusRepository;
import com.pipewright.core.idempotency.JdbcRunStatusRepository;
import com.pipewright.core.idempotency.RunStatusRepository;
import com.pipewright.core.lock.InMemoryOwnershipLock;
import com.pipewright.core.lock.JdbcOwnershipLock;
import com.pipewright.core.lock.OwnershipLock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Auto-configuration for the coordination stores shared between step
 * processes: the ownership lock and the recorded run status. Ordered after
 * {@link DataSourceAutoConfiguration} so the DataSource condition sees the
 * configured pool.
 * <p>
 * When a {@link DataSource} is available (a SQLite file by default, PostgreSQL
 * when configured), JDBC-backed stores are created and their tables ensured.
 * Otherwise in-memory stores are used, which only coordinate within one process.
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public OwnershipLock jdbcOwnershipLock(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC ownership lock");
        var lock = new JdbcOwnershipLock(dataSource);
        lock.createTables();
        return lock;
    }

    @Bean
    @ConditionalOnMissingBean(OwnershipLock.class)
    public OwnershipLock inMemoryOwnershipLock() {
        log.info("No DataSource available; using in-memory ownership lock (claims end with this process)");
        return new InMemoryOwnershipLock();
    }

    @Bean
    @Primary
    @ConditionalOnBean(DataSource.class)
    public RunStatusRepository jdbcRunStatusRepository(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC run status repository");
        var repository = new JdbcRunStatusRepository(dataSource);
        repository.createTables();
        return repository;
    }

    @Bean
    @ConditionalOnMissingBean(RunStatusRepository.class)
    public RunStatusRepository inMemoryRunStatusRepository() {
        log.info("No DataSource available; using in-memory run status repository");
        return new InMemoryRunStatusRepository();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        return new SimpleMeterRegistry();
    }
}
