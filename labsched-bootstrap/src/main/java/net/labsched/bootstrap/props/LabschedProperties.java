package net.labsched.bootstrap.props;

import net.labsched.core.config.SchedulerSettings;
import net.labsched.core.model.HostStatus;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

@ConfigurationProperties("labsched")
public class LabschedProperties {
    private Scheduler scheduler = new Scheduler();
    private Inventory inventory = new Inventory();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public void setInventory(Inventory inventory) {
        this.inventory = inventory;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 5000;
        private long maintenanceDelayMs = 60000;
        private List<String> usableStatuses = new ArrayList<>(List.of("READY"));
        private String leasedStatus = "PENDING";
        private List<String> provisionableLabelPrefixes = new ArrayList<>(SchedulerSettings.DEFAULT_PROVISIONABLE_PREFIXES);

        /** Unknown status names fail fast instead of silently mapping to UNKNOWN. */
        public SchedulerSettings toSettings() {
            var usable = EnumSet.noneOf(HostStatus.class);
            for (String s : usableStatuses) usable.add(parseStatus(s));
            return new SchedulerSettings(usable, parseStatus(leasedStatus), provisionableLabelPrefixes);
        }

        private static HostStatus parseStatus(String s) {
            HostStatus status = HostStatus.from(s);
            if (status == HostStatus.UNKNOWN) {
                throw new IllegalArgumentException("labsched.scheduler: unknown host status '" + s + "'");
            }
            return status;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public List<String> getUsableStatuses() {
            return usableStatuses;
        }

        public void setUsableStatuses(List<String> usableStatuses) {
            this.usableStatuses = usableStatuses;
        }

        public String getLeasedStatus() {
            return leasedStatus;
        }

        public void setLeasedStatus(String leasedStatus) {
            this.leasedStatus = leasedStatus;
        }

        public List<String> getProvisionableLabelPrefixes() {
            return provisionableLabelPrefixes;
        }

        public void setProvisionableLabelPrefixes(List<String> provisionableLabelPrefixes) {
            this.provisionableLabelPrefixes = provisionableLabelPrefixes;
        }
    }

    public static class Inventory {
        private boolean enabled = true;
        private List<HostDef> hosts = new ArrayList<>();
        private List<AclGroupDef> aclGroups = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<HostDef> getHosts() {
            return hosts;
        }

        public void setHosts(List<HostDef> hosts) {
            this.hosts = hosts;
        }

        public List<AclGroupDef> getAclGroups() {
            return aclGroups;
        }

        public void setAclGroups(List<AclGroupDef> aclGroups) {
            this.aclGroups = aclGroups;
        }
    }

    public static class HostDef {
        private String hostname;
        private List<String> labels = new ArrayList<>();
        private List<String> aclGroups = new ArrayList<>();
        private boolean locked;
        private String lockedBy;

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public List<String> getLabels() {
            return labels;
        }

        public void setLabels(List<String> labels) {
            this.labels = labels;
        }

        public List<String> getAclGroups() {
            return aclGroups;
        }

        public void setAclGroups(List<String> aclGroups) {
            this.aclGroups = aclGroups;
        }

        public boolean isLocked() {
            return locked;
        }

        public void setLocked(boolean locked) {
            this.locked = locked;
        }

        public String getLockedBy() {
            return lockedBy;
        }

        public void setLockedBy(String lockedBy) {
            this.lockedBy = lockedBy;
        }

        @Override
        public String toString() {
            return "HostDef{" +
                    "hostname='" + hostname + '\'' +
                    ", labels=" + labels +
                    ", aclGroups=" + aclGroups +
                    ", locked=" + locked +
                    '}';
        }
    }

    public static class AclGroupDef {
        private String name;
        private List<String> users = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<String> getUsers() {
            return users;
        }

        public void setUsers(List<String> users) {
            this.users = users;
        }
    }
}
