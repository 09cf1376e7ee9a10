package net.labsched.core.service;

import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.spi.HostRepository;
import net.labsched.core.spi.QueueEntryRepository;
import net.labsched.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry transitions reported back by the job runner. */
public final class QueueEntryService {
    private static final Logger log = LoggerFactory.getLogger(QueueEntryService.class);

    private final QueueEntryRepository entries;
    private final HostRepository hosts;
    private final TxRunner tx;

    public QueueEntryService(QueueEntryRepository entries, HostRepository hosts, TxRunner tx) {
        this.entries = entries;
        this.hosts = hosts;
        this.tx = tx;
    }

    /**
     * The leased host failed pre-job checks. It is never offered to this entry again; the host is
     * released and the entry goes back to the queue for another host.
     */
    public void rejectHost(long entryId) throws Exception {
        tx.required(() -> {
            HostQueueEntry e = entries.lockById(entryId)
                    .orElseThrow(() -> new IllegalArgumentException("unknown queue entry " + entryId));
            if (!e.isMetahost()) {
                throw new IllegalStateException(e + " names its host; only metahost entries can be requeued");
            }
            if (!e.hasHost()) throw new IllegalStateException(e + " has no host to reject");

            entries.addIneligibleHost(entryId, e.hostId());
            hosts.release(e.hostId());
            entries.clearHost(entryId);
            log.info("{}: host {} rejected, entry requeued", e, e.hostId());
            return null;
        });
    }

    /**
     * Terminal status. The host lease ends with the entry, but only an active entry holds one: a
     * queued direct entry names a host that may be leased to someone else. Repeated reports are
     * ignored.
     */
    public void complete(long entryId, HostQueueEntry.Status status) throws Exception {
        if (!status.terminal()) throw new IllegalArgumentException("not a terminal status: " + status);
        tx.required(() -> {
            HostQueueEntry e = entries.lockById(entryId)
                    .orElseThrow(() -> new IllegalArgumentException("unknown queue entry " + entryId));
            if (!entries.markComplete(entryId, status)) {
                log.info("{}: already complete, ignoring {}", e, status);
                return null;
            }
            if (e.active() && e.hasHost()) hosts.release(e.hostId());
            return null;
        });
    }
}
