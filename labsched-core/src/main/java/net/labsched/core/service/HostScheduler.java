package net.labsched.core.service;

import net.labsched.core.eligibility.HostEligibilityFilter;
import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.model.LabelExpression;
import net.labsched.core.spi.HostRepository;
import net.labsched.core.spi.QueueEntryRepository;
import net.labsched.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Leases at most one host per queue entry per pass. The in-memory pool keeps a pass from handing a
 * host out twice; the durable {@link HostRepository#tryLease} keeps two scheduler processes apart.
 */
public final class HostScheduler {
    private static final Logger log = LoggerFactory.getLogger(HostScheduler.class);

    private final HostRepository hosts;
    private final QueueEntryRepository entries;
    private final TxRunner tx;
    private final HostEligibilityFilter filter;

    public HostScheduler(HostRepository hosts,
                         QueueEntryRepository entries,
                         TxRunner tx,
                         HostEligibilityFilter filter) {
        this.hosts = hosts;
        this.entries = entries;
        this.tx = tx;
        this.filter = filter;
    }

    /** Leased host, or empty when the entry stays unresolved this pass. Hostless entries are never leased. */
    public Optional<Host> schedule(HostQueueEntry entry, SchedulingContext ctx) throws Exception {
        if (entry.hasHost()) return scheduleDirect(entry, ctx);
        if (entry.isMetahost()) return scheduleMetahost(entry, ctx.index().expressionFor(entry), ctx);
        return Optional.empty();
    }

    /** The entry already names its host: lease it if it is still eligible. */
    public Optional<Host> scheduleDirect(HostQueueEntry entry, SchedulingContext ctx) throws Exception {
        Host host = ctx.host(entry.hostId());
        if (host == null || !ctx.pool().isAvailable(host.id())) {
            log.debug("{}: host {} not available this pass", entry, entry.hostId());
            return Optional.empty();
        }
        if (!filter.isEligible(host, entry, ctx)) return Optional.empty();
        return lease(entry, host, ctx).host();
    }

    /** First eligible candidate in index order wins. */
    public Optional<Host> scheduleMetahost(HostQueueEntry entry, LabelExpression expr, SchedulingContext ctx) throws Exception {
        if (expr.isEmpty()) {
            log.debug("{}: empty label expression", entry);
            return Optional.empty();
        }
        for (Long hostId : ctx.pool().candidates(expr)) {
            Host host = ctx.host(hostId);
            if (!filter.isEligible(host, entry, ctx)) continue;
            Lease lease = lease(entry, host, ctx);
            if (lease.outcome() != Outcome.HOST_TAKEN) return lease.host();
        }
        log.debug("{}: no eligible host for {}", entry, expr);
        return Optional.empty();
    }

    enum Outcome { LEASED, HOST_TAKEN, ENTRY_TAKEN }

    record Lease(Outcome outcome, Optional<Host> host) {}

    /**
     * Commits the lease and set_host together. A host taken by another scheduler is dropped for the
     * rest of the pass; an entry taken by another scheduler gives its host back.
     */
    Lease lease(HostQueueEntry entry, Host host, SchedulingContext ctx) throws Exception {
        var settings = ctx.settings();
        Outcome outcome = tx.requiresNew(() -> {
            if (!hosts.tryLease(host.id(), settings.usableStatuses(), settings.leasedStatus())) return Outcome.HOST_TAKEN;
            if (!entries.assignHost(entry.id(), host.id())) {
                hosts.release(host.id());
                return Outcome.ENTRY_TAKEN;
            }
            return Outcome.LEASED;
        });
        switch (outcome) {
            case HOST_TAKEN:
                log.warn("{}: lost lease race for {}, trying next candidate", entry, host);
                ctx.recordRaceLost(host.id());
                return new Lease(outcome, Optional.empty());
            case ENTRY_TAKEN:
                log.info("{}: already scheduled by another scheduler", entry);
                ctx.recordEntryTaken();
                return new Lease(outcome, Optional.empty());
            default:
                ctx.pool().popHost(host.id());
                log.debug("{}: leased {}", entry, host);
                return new Lease(outcome, Optional.of(host.withLease(true, settings.leasedStatus())));
        }
    }
}
