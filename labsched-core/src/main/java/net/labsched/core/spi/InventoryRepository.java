package net.labsched.core.spi;

import net.labsched.core.model.Host;

import java.util.Optional;

/** Lab inventory writes. Every operation is idempotent. */
public interface InventoryRepository {
    long upsertHost(String hostname, boolean locked, String lockedBy) throws Exception;
    long upsertLabel(String name) throws Exception;
    void addLabelToHost(long hostId, long labelId) throws Exception;
    long upsertAclGroup(String name) throws Exception;
    void addHostToAclGroup(long aclGroupId, long hostId) throws Exception;
    void addUserToAclGroup(long aclGroupId, String login) throws Exception;
    Optional<Host> findHostByName(String hostname) throws Exception;
}
