package net.labsched.core.service;

import net.labsched.core.maintenance.MaintenanceService;

public final class Orchestrator {
    private final SchedulingPassService pass;
    private final MaintenanceService maintenance;

    public Orchestrator(SchedulingPassService pass, MaintenanceService maintenance) {
        this.pass = pass;
        this.maintenance = maintenance;
    }

    /** One tick: a scheduling pass. Unresolved entries wait for the next tick. */
    public SchedulingPassService.PassReport tick() throws Exception {
        return pass.runPass();
    }

    /** Host release and assignment audit, on its own cadence. */
    public MaintenanceService.MaintenanceReport maintain() throws Exception {
        return maintenance.runOnce();
    }
}
