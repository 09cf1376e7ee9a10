package net.labsched.core.eligibility;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.service.SchedulingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a host may be leased to a queue entry right now. All checks must pass:
 * <ol>
 *   <li>usable: not locked, not leased, status in the usable set</li>
 *   <li>not rejected before for this entry</li>
 *   <li>shares an ACL group with the job</li>
 *   <li>carries every non-provisionable job dependency</li>
 * </ol>
 */
public final class HostEligibilityFilter {
    private static final Logger log = LoggerFactory.getLogger(HostEligibilityFilter.class);

    public static final EligibilityCheck USABLE = new EligibilityCheck() {
        @Override public boolean test(Host host, HostQueueEntry entry, SchedulingContext ctx) {
            return isHostUsable(host, ctx);
        }
        @Override public String name() { return "usable"; }
    };

    public static final EligibilityCheck NOT_INELIGIBLE = new EligibilityCheck() {
        @Override public boolean test(Host host, HostQueueEntry entry, SchedulingContext ctx) {
            return !ctx.ineligibleHostsFor(entry).contains(host.id());
        }
        @Override public String name() { return "not-ineligible"; }
    };

    public static final EligibilityCheck ACL = new EligibilityCheck() {
        @Override public boolean test(Host host, HostQueueEntry entry, SchedulingContext ctx) {
            Set<Long> jobAcls = ctx.index().aclGroups(entry.jobId());
            for (Long group : host.aclGroupIds()) {
                if (jobAcls.contains(group)) return true;
            }
            return false;
        }
        @Override public String name() { return "acl"; }
    };

    public static final EligibilityCheck DEPENDENCIES = new EligibilityCheck() {
        @Override public boolean test(Host host, HostQueueEntry entry, SchedulingContext ctx) {
            for (String dep : ctx.index().dependencies(entry.jobId())) {
                if (ctx.settings().isProvisionable(dep)) continue;
                if (!host.hasLabel(dep)) return false;
            }
            return true;
        }
        @Override public String name() { return "dependencies"; }
    };

    private final List<EligibilityCheck> checks;

    public HostEligibilityFilter() {
        this(List.of(USABLE, NOT_INELIGIBLE, ACL, DEPENDENCIES));
    }

    public HostEligibilityFilter(List<EligibilityCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static boolean isHostUsable(Host host, SchedulingContext ctx) {
        return !host.locked() && !host.leased() && ctx.settings().isUsable(host.status());
    }

    public boolean isEligible(Host host, HostQueueEntry entry, SchedulingContext ctx) {
        if (host == null) return false;
        for (EligibilityCheck check : checks) {
            if (!check.test(host, entry, ctx)) {
                log.debug("{} not eligible for {}: failed {}", host, entry, check.name());
                return false;
            }
        }
        return true;
    }
}
