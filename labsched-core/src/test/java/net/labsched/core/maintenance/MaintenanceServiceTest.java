package net.labsched.core.maintenance;

import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.HostStatus;
import net.labsched.core.spi.TxRunner;
import net.labsched.core.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MaintenanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryEntityStore store;
    private MaintenanceService maintenance;
    private long jobId;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        maintenance = new MaintenanceService(store.hostRepo, TxRunner.direct(), () -> NOW);
        jobId = store.addJob("j", 0, Set.of(), Set.of(1L)).id();
    }

    @Test
    void releasesLeasedReadyHostsWithoutActiveEntry() throws Exception {
        long orphan = store.addHost("orphan", Set.of(), Set.of(1L)).id();
        long inUse = store.addHost("in-use", Set.of(), Set.of(1L)).id();
        long busy = store.addHost("busy", Set.of(), Set.of(1L)).id();
        store.putHost(store.host(orphan).withLease(true, HostStatus.READY));
        store.putHost(store.host(inUse).withLease(true, HostStatus.READY));
        store.putHost(store.host(busy).withLease(true, HostStatus.RUNNING));
        var e = store.addEntry(jobId, inUse, null);
        store.entryRepo.assignHost(e.id(), inUse);

        var report = maintenance.runOnce();

        assertEquals(1, report.releasedHosts);
        assertEquals(NOW, report.timestamp);
        assertFalse(store.host(orphan).leased());
        assertTrue(store.host(inUse).leased());
        assertTrue(store.host(busy).leased(), "only READY hosts are released");
    }

    @Test
    void reportsHostsSharedByActiveEntries() throws Exception {
        long h = store.addHost("h", Set.of(), Set.of(1L)).id();
        var e1 = store.addEntry(jobId, h, null);
        var e2 = store.addEntry(jobId, h, null);
        store.entryRepo.assignHost(e1.id(), h);
        store.entryRepo.assignHost(e2.id(), h);

        assertEquals(1, maintenance.runOnce().overlappingHosts);

        store.entryRepo.markComplete(e2.id(), HostQueueEntry.Status.ABORTED);
        assertEquals(0, maintenance.runOnce().overlappingHosts);
    }
}
