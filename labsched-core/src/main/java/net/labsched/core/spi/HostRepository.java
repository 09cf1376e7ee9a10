package net.labsched.core.spi;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface HostRepository {
    /** Hosts carrying at least one of the labels, labels and ACL groups loaded. Ordered by id. */
    List<Host> findByLabelNames(Collection<String> labelNames) throws Exception;

    /** Ordered by id; unknown ids are skipped. */
    List<Host> findByIds(Collection<Long> hostIds) throws Exception;

    /**
     * Durable lease: sets LEASED and the given status only while the host is unleased, unlocked and
     * in one of {@code usable}. Returns false when another scheduler got there first.
     */
    boolean tryLease(long hostId, Set<HostStatus> usable, HostStatus leasedStatus) throws Exception;

    /** Clears the lease. A host still in the leased status goes back to READY. */
    void release(long hostId) throws Exception;

    /**
     * Status change reported by processes outside the scheduling pass (verify, repair, cleanup).
     * Does not touch the lease.
     */
    void setStatus(long hostId, HostStatus status) throws Exception;

    /** Clears the lease of READY hosts no active, incomplete entry points at. Returns released host ids. */
    List<Long> releaseUnused() throws Exception;

    /** host id -> ids of the active entries sharing it, only for hosts with more than one. */
    Map<Long, List<Long>> findOverlappingAssignments() throws Exception;
}
