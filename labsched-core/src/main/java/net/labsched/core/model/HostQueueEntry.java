package net.labsched.core.model;

import java.time.Instant;

public record HostQueueEntry(
        Long id,
        Long jobId,
        Long hostId,         // set for direct entries, or once leased
        String metaHost,     // label expression, e.g. "platform_Fake1+has_awesome_card"
        Status status,
        boolean active,
        boolean complete,
        Instant createdAt
) {
    public enum Status {
        QUEUED, PENDING, STARTING, RUNNING, COMPLETED, FAILED, ABORTED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean terminal() { return this == COMPLETED || this == FAILED || this == ABORTED; }
    }

    public boolean hasHost() { return hostId != null; }

    public boolean isMetahost() { return metaHost != null; }

    /** Neither a host nor a label expression: runs without a DUT. */
    public boolean isHostless() { return hostId == null && metaHost == null; }

    public HostQueueEntry withHost(Long hostId, boolean active) {
        return new HostQueueEntry(id, jobId, hostId, metaHost, status, active, complete, createdAt);
    }

    @Override public String toString() {
        return "HQE#" + id + "(job=" + jobId
                + (hostId != null ? ", host=" + hostId : "")
                + (metaHost != null ? ", meta=" + metaHost : "") + ")";
    }
}
