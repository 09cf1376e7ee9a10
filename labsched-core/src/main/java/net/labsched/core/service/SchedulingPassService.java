package net.labsched.core.service;

import net.labsched.core.model.Assignment;
import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.Job;
import net.labsched.core.spi.DispatchAdapter;
import net.labsched.core.spi.JobRepository;
import net.labsched.core.spi.QueueEntryRepository;
import net.labsched.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One scheduling pass: pending entries in priority order against a fresh snapshot of hosts. Entries
 * left unresolved are simply picked up again by the next pass.
 */
public final class SchedulingPassService {
    private static final Logger log = LoggerFactory.getLogger(SchedulingPassService.class);

    private final QueueEntryRepository entries;
    private final JobRepository jobs;
    private final SchedulingContextFactory contexts;
    private final HostScheduler scheduler;
    private final DispatchAdapter dispatcher;
    private final TxRunner tx;

    public SchedulingPassService(QueueEntryRepository entries,
                                 JobRepository jobs,
                                 SchedulingContextFactory contexts,
                                 HostScheduler scheduler,
                                 DispatchAdapter dispatcher,
                                 TxRunner tx) {
        this.entries = entries;
        this.jobs = jobs;
        this.contexts = contexts;
        this.scheduler = scheduler;
        this.dispatcher = dispatcher;
        this.tx = tx;
    }

    /**
     * Priority desc, then entries with a host, then entries with a metahost, then job id and entry
     * id. Higher-priority jobs get first pick of shared hosts.
     */
    public static Comparator<HostQueueEntry> priorityOrder(Map<Long, Job> jobsById) {
        return Comparator
                .comparingInt((HostQueueEntry e) -> {
                    Job j = jobsById.get(e.jobId());
                    return j == null ? 0 : j.priority();
                }).reversed()
                .thenComparing(e -> !e.hasHost())
                .thenComparing(e -> !e.isMetahost())
                .thenComparing(HostQueueEntry::jobId)
                .thenComparing(HostQueueEntry::id);
    }

    /** Storage failures propagate and abort the pass; leases committed so far stay committed. */
    public PassReport runPass() throws Exception {
        var report = new PassReport();

        List<HostQueueEntry> pending = tx.required(entries::findPending);
        if (pending.isEmpty()) return report;

        var jobIds = new LinkedHashSet<Long>();
        for (HostQueueEntry e : pending) jobIds.add(e.jobId());
        Map<Long, Job> jobsById = tx.required(() -> jobs.findByIds(jobIds));

        List<HostQueueEntry> batch = new ArrayList<>(pending);
        batch.sort(priorityOrder(jobsById));
        SchedulingContext ctx = tx.required(() -> contexts.create(batch));

        report.entries = batch.size();
        for (HostQueueEntry entry : batch) {
            if (entry.isHostless()) {
                if (tx.requiresNew(() -> entries.activate(entry.id()))) {
                    report.assignments.add(new Assignment(entry, null));
                    report.hostless++;
                } else {
                    report.entriesTaken++;
                }
                continue;
            }
            int takenBefore = ctx.entriesTaken();
            Optional<Host> host = scheduler.schedule(entry, ctx);
            if (host.isPresent()) {
                report.assignments.add(new Assignment(entry.withHost(host.get().id(), true), host.get()));
                report.leased++;
            } else if (ctx.entriesTaken() == takenBefore) {
                report.unresolved++;
            }
        }
        report.racesLost = ctx.racesLost();
        report.entriesTaken += ctx.entriesTaken();

        for (Assignment a : report.assignments) {
            try {
                dispatcher.dispatch(a);
            } catch (Exception e) {
                // lease is committed; the entry stays active for recovery to pick up
                report.dispatchFailures++;
                log.warn("dispatch failed for {} on {}", a.entry(), a.host(), e);
            }
        }

        log.info("Scheduling pass: {}", report);
        return report;
    }

    /** Outcome of one pass. */
    public static final class PassReport {
        public int entries;
        public int leased;
        public int hostless;
        public int unresolved;
        public int racesLost;
        public int entriesTaken;
        public int dispatchFailures;
        public final List<Assignment> assignments = new ArrayList<>();

        @Override public String toString() {
            return "PassReport{" +
                    "entries=" + entries +
                    ", leased=" + leased +
                    ", hostless=" + hostless +
                    ", unresolved=" + unresolved +
                    ", racesLost=" + racesLost +
                    ", entriesTaken=" + entriesTaken +
                    ", dispatchFailures=" + dispatchFailures +
                    '}';
        }
    }
}
