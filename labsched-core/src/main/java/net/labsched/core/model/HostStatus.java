package net.labsched.core.model;

/** Host lifecycle states. Maintenance states are opaque to the scheduler. */
public enum HostStatus {
    READY, PENDING, RUNNING, VERIFYING, CLEANING, PROVISIONING, REPAIRING, REPAIR_FAILED, UNKNOWN;

    public static HostStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return HostStatus.valueOf(s.trim().toUpperCase().replace(' ', '_')); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
    public String code() { return name(); }
}
