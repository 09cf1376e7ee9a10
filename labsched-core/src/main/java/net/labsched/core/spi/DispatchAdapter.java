package net.labsched.core.spi;

import net.labsched.core.model.Assignment;

/** Turns a leased pairing into a job-runner launch. */
@FunctionalInterface
public interface DispatchAdapter {
    void dispatch(Assignment assignment) throws Exception;
}
