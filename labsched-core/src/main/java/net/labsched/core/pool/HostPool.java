package net.labsched.core.pool;

import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.index.LabelIndex;
import net.labsched.core.model.Host;
import net.labsched.core.model.LabelExpression;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Hosts still leasable in the current pass, keyed by label. Only shrinks: {@link #popHost} removes a
 * host from every label set. Owned by a single pass, not thread safe.
 */
public final class HostPool {
    private final Map<String, Set<Long>> availableByLabel = new HashMap<>();
    private final Set<Long> available = new LinkedHashSet<>();

    private HostPool() {}

    /** Seeds the pool with the index's hosts that are unlocked, unleased and in a usable status. */
    public static HostPool from(LabelIndex index, SchedulerSettings settings) {
        var pool = new HostPool();
        for (Host h : index.hosts()) {
            if (h.locked() || h.leased() || !settings.isUsable(h.status())) continue;
            pool.available.add(h.id());
        }
        index.labelHosts().forEach((label, ids) -> {
            var free = new LinkedHashSet<Long>();
            for (Long id : ids) if (pool.available.contains(id)) free.add(id);
            if (!free.isEmpty()) pool.availableByLabel.put(label, free);
        });
        return pool;
    }

    public boolean isAvailable(long hostId) { return available.contains(hostId); }

    /** Removes the host from every label set. Safe to repeat. */
    public void popHost(long hostId) {
        if (!available.remove(hostId)) return;
        var it = availableByLabel.values().iterator();
        while (it.hasNext()) {
            Set<Long> ids = it.next();
            ids.remove(hostId);
            if (ids.isEmpty()) it.remove();
        }
    }

    /** Available hosts carrying every label of {@code expr}, in index order. A snapshot copy. */
    public Set<Long> candidates(LabelExpression expr) {
        if (expr.isEmpty()) return Set.of();
        Set<Long> out = null;
        for (String label : expr.labels()) {
            Set<Long> ids = availableByLabel.get(label);
            if (ids == null) return Set.of();
            if (out == null) out = new LinkedHashSet<>(ids);
            else out.retainAll(ids);
            if (out.isEmpty()) return Set.of();
        }
        return out;
    }

    public Set<Long> availableForLabel(String label) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(availableByLabel.getOrDefault(label, Set.of())));
    }

    public int size() { return available.size(); }
}
