package net.labsched.bootstrap.inventory;

import net.labsched.bootstrap.props.LabschedProperties;
import net.labsched.core.spi.InventoryRepository;
import net.labsched.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/** Seeds ACL groups, hosts and labels from configuration. Safe to run on every start. */
public class InventoryRegistrar {
    private static final Logger log = LoggerFactory.getLogger(InventoryRegistrar.class);

    private final InventoryRepository inventory;
    private final TxRunner tx;

    public InventoryRegistrar(InventoryRepository inventory, TxRunner tx) {
        this.inventory = inventory;
        this.tx = tx;
    }

    public void register(LabschedProperties.Inventory def) throws Exception {
        Map<String, Long> groupIds = new HashMap<>();

        tx.required(() -> {
            for (var g : def.getAclGroups()) {
                if (g.getName() == null || g.getName().isBlank()) {
                    throw new IllegalArgumentException("acl-groups[].name is required");
                }
                long id = inventory.upsertAclGroup(g.getName());
                groupIds.put(g.getName(), id);
                for (String user : g.getUsers()) inventory.addUserToAclGroup(id, user);
            }
            return null;
        });

        for (var h : def.getHosts()) {
            registerHost(h, groupIds);
        }

        log.info("Inventory registered: aclGroups={} hosts={}", def.getAclGroups().size(), def.getHosts().size());
    }

    // one transaction per host, so a bad entry does not undo the ones before it
    private void registerHost(LabschedProperties.HostDef h, Map<String, Long> groupIds) throws Exception {
        if (h.getHostname() == null || h.getHostname().isBlank()) {
            throw new IllegalArgumentException("hosts[].hostname is required");
        }
        tx.required(() -> {
            long hostId = inventory.upsertHost(h.getHostname(), h.isLocked(), h.getLockedBy());
            for (String label : h.getLabels()) {
                inventory.addLabelToHost(hostId, inventory.upsertLabel(label));
            }
            for (String group : h.getAclGroups()) {
                Long groupId = groupIds.get(group);
                if (groupId == null) groupId = inventory.upsertAclGroup(group);
                inventory.addHostToAclGroup(groupId, hostId);
            }
            return null;
        });
        log.debug("Host registered: {}", h);
    }
}
