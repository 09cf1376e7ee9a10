package net.labsched.core.index;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.LabelExpression;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-pass read cache: label -> hosts, job -> dependencies, job -> ACL groups, entry -> parsed
 * label expression. Host ids inside every set iterate in ascending id order.
 */
public final class LabelIndex {
    private static final LabelIndex EMPTY = new LabelIndex(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());

    private final Map<String, Set<Long>> labelHosts;
    private final Map<Long, Host> hosts;
    private final Map<Long, Set<String>> jobDependencies;
    private final Map<Long, Set<Long>> jobAcls;
    private final Map<Long, LabelExpression> expressions;

    private LabelIndex(Map<String, Set<Long>> labelHosts,
                       Map<Long, Host> hosts,
                       Map<Long, Set<String>> jobDependencies,
                       Map<Long, Set<Long>> jobAcls,
                       Map<Long, LabelExpression> expressions) {
        this.labelHosts = labelHosts;
        this.hosts = hosts;
        this.jobDependencies = jobDependencies;
        this.jobAcls = jobAcls;
        this.expressions = expressions;
    }

    public static LabelIndex empty() { return EMPTY; }

    /**
     * @param batch           pending entries of this pass
     * @param referencedHosts hosts named by the batch, directly or through its label expressions
     * @param jobDependencies job id -> required labels, as returned by the entity store
     * @param jobAcls         job id -> ACL groups, as returned by the entity store
     */
    public static LabelIndex build(Collection<HostQueueEntry> batch,
                                   Collection<Host> referencedHosts,
                                   Map<Long, Set<String>> jobDependencies,
                                   Map<Long, Set<Long>> jobAcls) {
        if (batch.isEmpty()) return EMPTY;

        var sorted = referencedHosts.stream().sorted(Comparator.comparing(Host::id)).toList();
        Map<Long, Host> hostsById = new LinkedHashMap<>();
        Map<String, Set<Long>> byLabel = new HashMap<>();
        for (Host h : sorted) {
            hostsById.put(h.id(), h);
            for (String label : h.labels()) {
                byLabel.computeIfAbsent(label, k -> new LinkedHashSet<>()).add(h.id());
            }
        }
        byLabel.replaceAll((k, v) -> Collections.unmodifiableSet(v));

        Map<Long, Set<String>> deps = new HashMap<>();
        Map<Long, Set<Long>> acls = new HashMap<>();
        Map<Long, LabelExpression> exprs = new HashMap<>();
        for (HostQueueEntry e : batch) {
            deps.put(e.jobId(), Set.copyOf(jobDependencies.getOrDefault(e.jobId(), Set.of())));
            acls.put(e.jobId(), Set.copyOf(jobAcls.getOrDefault(e.jobId(), Set.of())));
            if (e.isMetahost()) exprs.put(e.id(), LabelExpression.parse(e.metaHost()));
        }

        return new LabelIndex(Collections.unmodifiableMap(byLabel),
                Collections.unmodifiableMap(hostsById), deps, acls, exprs);
    }

    /** Ascending host ids carrying {@code label}; empty for unknown labels. */
    public Set<Long> hostsForLabel(String label) {
        return labelHosts.getOrDefault(label, Set.of());
    }

    /** Hosts carrying every label of the expression, ascending id. Empty for an empty expression. */
    public Set<Long> hostsForLabelExpression(LabelExpression expr) {
        return intersect(expr.labels(), labelHosts);
    }

    public Set<Long> hostsForLabelExpression(String expr) {
        return hostsForLabelExpression(LabelExpression.parse(expr));
    }

    private static Set<Long> intersect(List<String> labels, Map<String, ? extends Set<Long>> sets) {
        if (labels.isEmpty()) return Set.of();
        Set<Long> out = null;
        for (String label : labels) {
            Set<Long> hostsOfLabel = sets.get(label);
            if (hostsOfLabel == null || hostsOfLabel.isEmpty()) return Set.of();
            if (out == null) {
                out = new LinkedHashSet<>(hostsOfLabel);
            } else {
                out.retainAll(hostsOfLabel);
                if (out.isEmpty()) return Set.of();
            }
        }
        return out;
    }

    /** Parsed expression of a metahost entry; empty for other entries. */
    public LabelExpression expressionFor(HostQueueEntry entry) {
        return expressions.getOrDefault(entry.id(), LabelExpression.parse(entry.metaHost()));
    }

    public Host host(long hostId) { return hosts.get(hostId); }

    /** Hosts in ascending id order. */
    public Collection<Host> hosts() { return hosts.values(); }

    public Set<String> dependencies(long jobId) { return jobDependencies.getOrDefault(jobId, Set.of()); }

    public Set<Long> aclGroups(long jobId) { return jobAcls.getOrDefault(jobId, Set.of()); }

    public Map<String, Set<Long>> labelHosts() { return labelHosts; }
}
