package net.labsched.bootstrap.autoconfigure;

import net.labsched.bootstrap.inventory.InventoryRegistrar;
import net.labsched.bootstrap.props.LabschedProperties;
import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.eligibility.HostEligibilityFilter;
import net.labsched.core.maintenance.MaintenanceService;
import net.labsched.core.service.*;
import net.labsched.core.spi.*;
import net.labsched.integration.spring.LabschedSpringConfig;
import net.labsched.integration.spring.dispatch.LoggingDispatchAdapter;
import net.labsched.integration.spring.sched.LabschedSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(LabschedProperties.class)
@Import(LabschedSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class LabschedAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(LabschedAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SchedulerSettings schedulerSettings(LabschedProperties props) {
        return props.getScheduler().toSettings();
    }

    @Bean
    @ConditionalOnMissingBean(DispatchAdapter.class)
    public DispatchAdapter dispatchAdapter() {
        return new LoggingDispatchAdapter();
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public HostEligibilityFilter hostEligibilityFilter() {
        return new HostEligibilityFilter();
    }

    @Bean
    @ConditionalOnMissingBean
    public HostScheduler hostScheduler(HostRepository hosts,
                                       QueueEntryRepository entries,
                                       TxRunner tx,
                                       HostEligibilityFilter filter) {
        return new HostScheduler(hosts, entries, tx, filter);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingContextFactory schedulingContextFactory(HostRepository hosts,
                                                             JobRepository jobs,
                                                             QueueEntryRepository entries,
                                                             SchedulerSettings settings) {
        return new SchedulingContextFactory(hosts, jobs, entries, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingPassService schedulingPass(QueueEntryRepository entries,
                                                JobRepository jobs,
                                                SchedulingContextFactory contexts,
                                                HostScheduler scheduler,
                                                DispatchAdapter dispatcher,
                                                TxRunner tx) {
        return new SchedulingPassService(entries, jobs, contexts, scheduler, dispatcher, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(HostRepository hosts, TxRunner tx, Clock clock) {
        return new MaintenanceService(hosts, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Orchestrator orchestrator(SchedulingPassService pass, MaintenanceService maintenance) {
        return new Orchestrator(pass, maintenance);
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueEntryService queueEntryService(QueueEntryRepository entries, HostRepository hosts, TxRunner tx) {
        return new QueueEntryService(entries, hosts, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobSubmissionService jobSubmissionService(JobRepository jobs, QueueEntryRepository entries, TxRunner tx) {
        return new JobSubmissionService(jobs, entries, tx);
    }

    // --- loops (delays come from labsched.scheduler.*-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "labsched.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LabschedSchedulers labschedSchedulers(Orchestrator orchestrator) {
        return new LabschedSchedulers(orchestrator);
    }

    // --- inventory seeding ---

    @Bean
    @ConditionalOnMissingBean
    public InventoryRegistrar inventoryRegistrar(InventoryRepository inventory, TxRunner tx) {
        return new InventoryRegistrar(inventory, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "labsched.inventory", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner inventoryRunner(InventoryRegistrar registrar, LabschedProperties props) {
        log.info("Inventory seeding enabled: {} hosts configured", props.getInventory().getHosts().size());
        return args -> registrar.register(props.getInventory());
    }
}
