package net.labsched.core.model;

import java.util.Set;

public record Host(
        Long id,
        String hostname,
        HostStatus status,
        boolean locked,
        String lockedBy,     // null when unlocked
        boolean leased,      // durable lease bit, owned by exactly one queue entry
        Set<String> labels,
        Set<Long> aclGroupIds
) {
    public Host {
        labels = labels == null ? Set.of() : Set.copyOf(labels);
        aclGroupIds = aclGroupIds == null ? Set.of() : Set.copyOf(aclGroupIds);
    }

    public boolean hasLabel(String name) { return labels.contains(name); }

    public Host withLease(boolean leased, HostStatus status) {
        return new Host(id, hostname, status, locked, lockedBy, leased, labels, aclGroupIds);
    }

    @Override public String toString() {
        return hostname + "#" + id + "[" + status + (locked ? ",locked" : "") + (leased ? ",leased" : "") + "]";
    }
}
