package net.labsched.core.maintenance;

import net.labsched.core.spi.Clock;
import net.labsched.core.spi.HostRepository;
import net.labsched.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final HostRepository hosts;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(HostRepository hosts, TxRunner tx, Clock clock) {
        this.hosts = hosts;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * Periodic housekeeping.
     * - release leased READY hosts that no active entry uses
     * - report hosts shared by more than one active entry
     */
    public MaintenanceReport runOnce() throws Exception {
        MaintenanceReport r = new MaintenanceReport();

        List<Long> released = tx.required(hosts::releaseUnused);
        r.releasedHosts = released.size();
        if (!released.isEmpty()) log.info("Released {} unused hosts: {}", released.size(), released);

        Map<Long, List<Long>> overlapping = tx.required(hosts::findOverlappingAssignments);
        r.overlappingHosts = overlapping.size();
        overlapping.forEach((hostId, entryIds) ->
                log.warn("Host {} is assigned to {} active entries: {}", hostId, entryIds.size(), entryIds));

        r.timestamp = clock.now();
        return r;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int releasedHosts;
        public int overlappingHosts;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", releasedHosts=" + releasedHosts +
                    ", overlappingHosts=" + overlappingHosts +
                    '}';
        }
    }
}
