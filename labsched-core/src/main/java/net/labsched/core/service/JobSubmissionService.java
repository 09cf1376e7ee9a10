package net.labsched.core.service;

import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.Job;
import net.labsched.core.model.LabelExpression;
import net.labsched.core.spi.JobRepository;
import net.labsched.core.spi.QueueEntryRepository;
import net.labsched.core.spi.TxRunner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public final class JobSubmissionService {
    private final JobRepository jobs;
    private final QueueEntryRepository entries;
    private final TxRunner tx;

    public JobSubmissionService(JobRepository jobs, QueueEntryRepository entries, TxRunner tx) {
        this.jobs = jobs;
        this.entries = entries;
        this.tx = tx;
    }

    /** One entry per named host. */
    public List<HostQueueEntry> submitOnHosts(Job job, Set<String> dependencies, Collection<Long> hostIds) throws Exception {
        if (hostIds.isEmpty()) throw new IllegalArgumentException("hostIds must not be empty");
        return tx.required(() -> {
            Job saved = jobs.insert(job, dependencies);
            var out = new ArrayList<HostQueueEntry>();
            for (Long hostId : hostIds) out.add(entries.insert(saved.id(), hostId, null));
            return out;
        });
    }

    /** {@code count} entries resolved against {@code metaHost} at scheduling time. */
    public List<HostQueueEntry> submitOnMetahost(Job job, Set<String> dependencies, String metaHost, int count) throws Exception {
        var expr = LabelExpression.parse(metaHost);
        if (expr.isEmpty()) throw new IllegalArgumentException("empty label expression: '" + metaHost + "'");
        if (count < 1) throw new IllegalArgumentException("count must be positive");
        return tx.required(() -> {
            Job saved = jobs.insert(job, dependencies);
            var out = new ArrayList<HostQueueEntry>();
            for (int i = 0; i < count; i++) out.add(entries.insert(saved.id(), null, expr.toString()));
            return out;
        });
    }

    /** Suite-style job that runs without a host. */
    public HostQueueEntry submitHostless(Job job) throws Exception {
        return tx.required(() -> {
            Job saved = jobs.insert(job, Set.of());
            return entries.insert(saved.id(), null, null);
        });
    }
}
