package net.labsched.core.model;

import java.time.Instant;

public record Job(
        Long id,
        String name,
        String owner,        // login; ACL groups are resolved through the owner's memberships
        int priority,        // higher = more urgent
        Long parentJobId,
        Instant createdAt
) {
    public static Job ofNew(String name, String owner, int priority, Long parentJobId) {
        return new Job(null, name, owner, priority, parentJobId, null);
    }
}
