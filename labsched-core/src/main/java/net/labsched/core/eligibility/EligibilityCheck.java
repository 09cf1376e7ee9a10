package net.labsched.core.eligibility;

import net.labsched.core.model.Host;
import net.labsched.core.model.HostQueueEntry;
import net.labsched.core.service.SchedulingContext;

/** One condition a host must meet to be leased to an entry. Must not throw. */
@FunctionalInterface
public interface EligibilityCheck {
    boolean test(Host host, HostQueueEntry entry, SchedulingContext ctx);

    default String name() { return getClass().getSimpleName(); }
}
