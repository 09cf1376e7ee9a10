package net.labsched.integration.spring;

import net.labsched.adapter.jdbc.repo.*;
import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.spi.*;
import net.labsched.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/** Entity store, transactions and clock over the application's DataSource. */
@Configuration
public class LabschedSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public HostRepository hostRepository(DataSource ds, SchedulerSettings settings) {
        return new JdbcHostRepository(ds, settings.leasedStatus());
    }

    @Bean public JobRepository jobRepository(DataSource ds) { return new JdbcJobRepository(ds); }
    @Bean public QueueEntryRepository queueEntryRepository(DataSource ds) { return new JdbcQueueEntryRepository(ds); }
    @Bean public InventoryRepository inventoryRepository(DataSource ds) { return new JdbcInventoryRepository(ds); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
