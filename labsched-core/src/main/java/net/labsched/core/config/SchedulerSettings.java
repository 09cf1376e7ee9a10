package net.labsched.core.config;

import net.labsched.core.model.HostStatus;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable scheduler knobs, passed by constructor.
 *
 * @param usableStatuses        host statuses a lease may start from
 * @param leasedStatus          status a host takes when leased ("about to run")
 * @param provisionablePrefixes label prefixes the job runner can satisfy by provisioning; such
 *                              dependencies are not required on the host
 */
public record SchedulerSettings(
        Set<HostStatus> usableStatuses,
        HostStatus leasedStatus,
        List<String> provisionablePrefixes
) {
    public static final List<String> DEFAULT_PROVISIONABLE_PREFIXES =
            List.of("cros-version", "fw-version", "fwrw-version");

    public SchedulerSettings {
        if (usableStatuses == null || usableStatuses.isEmpty()) {
            throw new IllegalArgumentException("usableStatuses must not be empty");
        }
        if (leasedStatus == null) throw new IllegalArgumentException("leasedStatus is required");
        usableStatuses = Set.copyOf(EnumSet.copyOf(usableStatuses));
        provisionablePrefixes = provisionablePrefixes == null ? List.of() : List.copyOf(provisionablePrefixes);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(EnumSet.of(HostStatus.READY), HostStatus.PENDING, DEFAULT_PROVISIONABLE_PREFIXES);
    }

    public boolean isUsable(HostStatus status) { return usableStatuses.contains(status); }

    /** True for labels like {@code cros-version:R80-12739.0.0} that provisioning can install. */
    public boolean isProvisionable(String labelName) {
        for (String prefix : provisionablePrefixes) {
            if (labelName.equals(prefix) || labelName.startsWith(prefix + ":")) return true;
        }
        return false;
    }
}
