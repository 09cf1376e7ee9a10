package net.labsched.core.service;

import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.index.LabelIndex;
import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.LabelExpression;
import net.labsched.core.spi.HostRepository;
import net.labsched.core.spi.JobRepository;
import net.labsched.core.spi.QueueEntryRepository;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Loads one pass worth of hosts, job requirements and rejections in batched queries. */
public final class SchedulingContextFactory {
    private final HostRepository hosts;
    private final JobRepository jobs;
    private final QueueEntryRepository entries;
    private final SchedulerSettings settings;

    public SchedulingContextFactory(HostRepository hosts,
                                    JobRepository jobs,
                                    QueueEntryRepository entries,
                                    SchedulerSettings settings) {
        this.hosts = hosts;
        this.jobs = jobs;
        this.entries = entries;
        this.settings = settings;
    }

    public SchedulingContext create(List<HostQueueEntry> batch) throws Exception {
        if (batch.isEmpty()) return new SchedulingContext(settings, LabelIndex.empty(), Map.of());

        Set<Long> jobIds = new LinkedHashSet<>();
        Set<Long> entryIds = new LinkedHashSet<>();
        Set<Long> directHostIds = new LinkedHashSet<>();
        Set<String> labels = new LinkedHashSet<>();
        for (HostQueueEntry e : batch) {
            jobIds.add(e.jobId());
            entryIds.add(e.id());
            if (e.hasHost()) directHostIds.add(e.hostId());
            else if (e.isMetahost()) labels.addAll(LabelExpression.parse(e.metaHost()).labels());
        }

        Map<Long, Host> referenced = new LinkedHashMap<>();
        if (!labels.isEmpty()) {
            for (Host h : hosts.findByLabelNames(labels)) referenced.put(h.id(), h);
        }
        if (!directHostIds.isEmpty()) {
            for (Host h : hosts.findByIds(directHostIds)) referenced.putIfAbsent(h.id(), h);
        }

        var index = LabelIndex.build(batch, referenced.values(),
                jobs.findDependencies(jobIds), jobs.findAclGroups(jobIds));
        return new SchedulingContext(settings, index, entries.findIneligibleHosts(entryIds));
    }
}
