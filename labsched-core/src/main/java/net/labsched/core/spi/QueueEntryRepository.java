package net.labsched.core.spi;

import net.labsched.core.model.HostQueueEntry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface QueueEntryRepository {
    /** QUEUED, inactive, incomplete entries. The caller re-sorts by priority. */
    List<HostQueueEntry> findPending() throws Exception;

    Optional<HostQueueEntry> findById(long entryId) throws Exception;

    /** Like {@link #findById}, holding the row until the transaction ends. */
    Optional<HostQueueEntry> lockById(long entryId) throws Exception;

    /**
     * set_host: binds the host and activates the entry, only while the entry is still inactive and
     * incomplete. False when another scheduler took the entry first.
     */
    boolean assignHost(long entryId, long hostId) throws Exception;

    /** Hostless entries: STARTING and active without a host. Same guard as {@link #assignHost}. */
    boolean activate(long entryId) throws Exception;

    /** Back to QUEUED, inactive, without host. */
    void clearHost(long entryId) throws Exception;

    /** entry id -> hosts already tried and rejected for it. */
    Map<Long, Set<Long>> findIneligibleHosts(Collection<Long> entryIds) throws Exception;

    void addIneligibleHost(long entryId, long hostId) throws Exception;

    /** Terminal status, inactive. False when the entry was already complete. */
    boolean markComplete(long entryId, HostQueueEntry.Status status) throws Exception;

    HostQueueEntry insert(long jobId, Long hostId, String metaHost) throws Exception;
}
