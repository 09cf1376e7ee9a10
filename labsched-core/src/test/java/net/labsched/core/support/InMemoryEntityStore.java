package net.labsched.core.support;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.HostStatus;
import net.labsched.core.model.Job;
import net.labsched.core.spi.HostRepository;
import net.labsched.core.spi.JobRepository;
import net.labsched.core.spi.QueueEntryRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Entity store fixture for core tests.
 * - ids come from per-table sequences starting at 1
 * - {@link #stealBeforeLease} simulates a second scheduler leasing a host between snapshot and commit
 * - {@link #takeEntryBeforeAssign} simulates a second scheduler scheduling the entry itself
 * - {@link #failOnPending} simulates an unreachable store
 */
public final class InMemoryEntityStore {
    public final Map<Long, Host> hosts = new TreeMap<>();
    public final Map<Long, Job> jobs = new TreeMap<>();
    public final Map<Long, Set<String>> jobDeps = new HashMap<>();
    public final Map<Long, Set<Long>> jobAcls = new HashMap<>();
    public final Map<Long, HostQueueEntry> entries = new LinkedHashMap<>();
    public final Map<Long, Set<Long>> ineligible = new HashMap<>();
    public final Set<Long> stolen = new HashSet<>();
    public final Set<Long> takenEntries = new HashSet<>();
    public final List<Long> leaseAttempts = new ArrayList<>();
    public boolean failOnPending;

    private long hostSeq = 1, jobSeq = 1, entrySeq = 1;

    public final HostRepository hostRepo = new Hosts();
    public final JobRepository jobRepo = new Jobs();
    public final QueueEntryRepository entryRepo = new Entries();

    // ---------- seeding ----------

    public Host addHost(String hostname, Set<String> labels, Set<Long> aclGroups) {
        return putHost(new Host(hostSeq++, hostname, HostStatus.READY, false, null, false, labels, aclGroups));
    }

    public Host putHost(Host h) {
        hosts.put(h.id(), h);
        hostSeq = Math.max(hostSeq, h.id() + 1);
        return h;
    }

    public void lock(long hostId) {
        Host h = hosts.get(hostId);
        putHost(new Host(h.id(), h.hostname(), h.status(), true, "admin", h.leased(), h.labels(), h.aclGroupIds()));
    }

    public void setStatus(long hostId, HostStatus status) {
        Host h = hosts.get(hostId);
        putHost(new Host(h.id(), h.hostname(), status, h.locked(), h.lockedBy(), h.leased(), h.labels(), h.aclGroupIds()));
    }

    public Job addJob(String name, int priority, Set<String> deps, Set<Long> acls) {
        Job j = new Job(jobSeq++, name, "autotest_system", priority, null, Instant.EPOCH);
        jobs.put(j.id(), j);
        if (!deps.isEmpty()) jobDeps.put(j.id(), Set.copyOf(deps));
        if (!acls.isEmpty()) jobAcls.put(j.id(), Set.copyOf(acls));
        return j;
    }

    public HostQueueEntry addEntry(long jobId, Long hostId, String metaHost) {
        var e = new HostQueueEntry(entrySeq++, jobId, hostId, metaHost, HostQueueEntry.Status.QUEUED,
                false, false, Instant.EPOCH);
        entries.put(e.id(), e);
        return e;
    }

    /** Next lease attempt on this host finds it already leased by someone else. */
    public void stealBeforeLease(long hostId) { stolen.add(hostId); }

    /** Next set_host on this entry finds it already activated by someone else. */
    public void takeEntryBeforeAssign(long entryId) { takenEntries.add(entryId); }

    public HostQueueEntry entry(long id) { return entries.get(id); }

    public Host host(long id) { return hosts.get(id); }

    private void putEntry(HostQueueEntry e) { entries.put(e.id(), e); }

    private static HostQueueEntry with(HostQueueEntry e, Long hostId, HostQueueEntry.Status status, boolean active, boolean complete) {
        return new HostQueueEntry(e.id(), e.jobId(), hostId, e.metaHost(), status, active, complete, e.createdAt());
    }

    // ---------- repositories ----------

    private final class Hosts implements HostRepository {
        @Override public List<Host> findByLabelNames(Collection<String> labelNames) {
            var out = new ArrayList<Host>();
            for (Host h : hosts.values()) {
                for (String l : labelNames) if (h.hasLabel(l)) { out.add(h); break; }
            }
            return out;
        }

        @Override public List<Host> findByIds(Collection<Long> hostIds) {
            var out = new ArrayList<Host>();
            for (Host h : hosts.values()) if (hostIds.contains(h.id())) out.add(h);
            return out;
        }

        @Override public boolean tryLease(long hostId, Set<HostStatus> usable, HostStatus leasedStatus) {
            leaseAttempts.add(hostId);
            Host h = hosts.get(hostId);
            if (h == null) return false;
            if (stolen.remove(hostId)) {
                putHost(h.withLease(true, leasedStatus));
                return false;
            }
            if (h.leased() || h.locked() || !usable.contains(h.status())) return false;
            putHost(h.withLease(true, leasedStatus));
            return true;
        }

        @Override public void release(long hostId) {
            Host h = hosts.get(hostId);
            if (h != null) putHost(h.withLease(false, h.status() == HostStatus.PENDING ? HostStatus.READY : h.status()));
        }

        @Override public void setStatus(long hostId, HostStatus status) {
            InMemoryEntityStore.this.setStatus(hostId, status);
        }

        @Override public List<Long> releaseUnused() {
            Set<Long> inUse = new HashSet<>();
            for (HostQueueEntry e : entries.values()) if (e.active() && !e.complete() && e.hasHost()) inUse.add(e.hostId());
            var released = new ArrayList<Long>();
            for (Host h : List.copyOf(hosts.values())) {
                if (h.leased() && h.status() == HostStatus.READY && !inUse.contains(h.id())) {
                    putHost(h.withLease(false, h.status()));
                    released.add(h.id());
                }
            }
            return released;
        }

        @Override public Map<Long, List<Long>> findOverlappingAssignments() {
            Map<Long, List<Long>> byHost = new TreeMap<>();
            for (HostQueueEntry e : entries.values()) {
                if (e.active() && !e.complete() && e.hasHost()) byHost.computeIfAbsent(e.hostId(), k -> new ArrayList<>()).add(e.id());
            }
            byHost.values().removeIf(ids -> ids.size() < 2);
            return byHost;
        }
    }

    private final class Jobs implements JobRepository {
        @Override public Map<Long, Job> findByIds(Collection<Long> jobIds) {
            Map<Long, Job> out = new HashMap<>();
            for (Long id : jobIds) if (jobs.containsKey(id)) out.put(id, jobs.get(id));
            return out;
        }

        @Override public Map<Long, Set<Long>> findAclGroups(Collection<Long> jobIds) {
            Map<Long, Set<Long>> out = new HashMap<>();
            for (Long id : jobIds) if (jobAcls.containsKey(id)) out.put(id, jobAcls.get(id));
            return out;
        }

        @Override public Map<Long, Set<String>> findDependencies(Collection<Long> jobIds) {
            Map<Long, Set<String>> out = new HashMap<>();
            for (Long id : jobIds) if (jobDeps.containsKey(id)) out.put(id, jobDeps.get(id));
            return out;
        }

        @Override public Job insert(Job job, Set<String> dependencies) {
            Job saved = new Job(jobSeq++, job.name(), job.owner(), job.priority(), job.parentJobId(), Instant.EPOCH);
            jobs.put(saved.id(), saved);
            if (!dependencies.isEmpty()) jobDeps.put(saved.id(), Set.copyOf(dependencies));
            return saved;
        }
    }

    private final class Entries implements QueueEntryRepository {
        @Override public List<HostQueueEntry> findPending() {
            if (failOnPending) throw new IllegalStateException("entity store unreachable");
            var out = new ArrayList<HostQueueEntry>();
            for (HostQueueEntry e : entries.values()) {
                if (!e.complete() && !e.active() && e.status() == HostQueueEntry.Status.QUEUED) out.add(e);
            }
            return out;
        }

        @Override public Optional<HostQueueEntry> findById(long entryId) {
            return Optional.ofNullable(entries.get(entryId));
        }

        @Override public Optional<HostQueueEntry> lockById(long entryId) {
            return findById(entryId);
        }

        @Override public boolean assignHost(long entryId, long hostId) {
            HostQueueEntry e = entries.get(entryId);
            if (takenEntries.remove(entryId)) {
                putEntry(with(e, e.hostId(), e.status(), true, false));
                return false;
            }
            if (e.active() || e.complete()) return false;
            putEntry(with(e, hostId, e.status(), true, false));
            return true;
        }

        @Override public boolean activate(long entryId) {
            HostQueueEntry e = entries.get(entryId);
            if (e.active() || e.complete()) return false;
            putEntry(with(e, e.hostId(), HostQueueEntry.Status.STARTING, true, false));
            return true;
        }

        @Override public void clearHost(long entryId) {
            HostQueueEntry e = entries.get(entryId);
            putEntry(with(e, null, HostQueueEntry.Status.QUEUED, false, false));
        }

        @Override public Map<Long, Set<Long>> findIneligibleHosts(Collection<Long> entryIds) {
            Map<Long, Set<Long>> out = new HashMap<>();
            for (Long id : entryIds) if (ineligible.containsKey(id)) out.put(id, Set.copyOf(ineligible.get(id)));
            return out;
        }

        @Override public void addIneligibleHost(long entryId, long hostId) {
            ineligible.computeIfAbsent(entryId, k -> new LinkedHashSet<>()).add(hostId);
        }

        @Override public boolean markComplete(long entryId, HostQueueEntry.Status status) {
            HostQueueEntry e = entries.get(entryId);
            if (e.complete()) return false;
            putEntry(with(e, e.hostId(), status, false, true));
            return true;
        }

        @Override public HostQueueEntry insert(long jobId, Long hostId, String metaHost) {
            return addEntry(jobId, hostId, metaHost);
        }
    }
}
