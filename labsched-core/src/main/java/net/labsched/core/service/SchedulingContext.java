package net.labsched.core.service;

import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.index.LabelIndex;
import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.pool.HostPool;

import java.util.Map;
import java.util.Set;

/**
 * Everything one scheduling pass reads, built fresh per pass and dropped afterwards. Nothing in here
 * survives into the next pass.
 */
public final class SchedulingContext {
    private final SchedulerSettings settings;
    private final LabelIndex index;
    private final HostPool pool;
    private final Map<Long, Set<Long>> ineligibleHosts;
    private int racesLost;
    private int entriesTaken;

    public SchedulingContext(SchedulerSettings settings,
                             LabelIndex index,
                             Map<Long, Set<Long>> ineligibleHosts) {
        this.settings = settings;
        this.index = index;
        this.pool = HostPool.from(index, settings);
        this.ineligibleHosts = Map.copyOf(ineligibleHosts);
    }

    public SchedulerSettings settings() { return settings; }
    public LabelIndex index() { return index; }
    public HostPool pool() { return pool; }

    /** Hosts already tried and rejected for this entry. */
    public Set<Long> ineligibleHostsFor(HostQueueEntry entry) {
        return ineligibleHosts.getOrDefault(entry.id(), Set.of());
    }

    public Host host(long hostId) { return index.host(hostId); }

    /** A host that looked free was leased by another scheduler before this pass could commit. */
    void recordRaceLost(long hostId) {
        racesLost++;
        pool.popHost(hostId);
    }

    /** The entry itself was scheduled by another scheduler between snapshot and commit. */
    void recordEntryTaken() { entriesTaken++; }

    public int racesLost() { return racesLost; }

    public int entriesTaken() { return entriesTaken; }
}
