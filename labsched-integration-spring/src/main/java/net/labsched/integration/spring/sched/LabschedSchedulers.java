package net.labsched.integration.spring.sched;

import net.labsched.core.service.Orchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Fixed-delay loops. A failed tick is logged and the next one runs as usual; pending entries are
 * simply picked up again.
 */
public class LabschedSchedulers {
    private static final Logger log = LoggerFactory.getLogger(LabschedSchedulers.class);

    private final Orchestrator orchestrator;

    public LabschedSchedulers(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(fixedDelayString = "${labsched.scheduler.tick-delay-ms:5000}")
    public void tick() {
        try {
            orchestrator.tick();
        } catch (Exception e) {
            log.error("Scheduling pass failed; retrying on next tick", e);
        }
    }

    @Scheduled(fixedDelayString = "${labsched.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() {
        try {
            var report = orchestrator.maintain();
            if (report.releasedHosts > 0 || report.overlappingHosts > 0) log.info("Maintenance: {}", report);
        } catch (Exception e) {
            log.error("Maintenance failed; retrying on next run", e);
        }
    }
}
