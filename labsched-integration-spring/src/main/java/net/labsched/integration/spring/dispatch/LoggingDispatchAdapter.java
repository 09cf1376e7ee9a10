package net.labsched.integration.spring.dispatch;

import net.labsched.core.model.Assignment;
import net.labsched.core.spi.DispatchAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default adapter until a job runner is wired in: records what would be launched. */
public class LoggingDispatchAdapter implements DispatchAdapter {
    private static final Logger log = LoggerFactory.getLogger(LoggingDispatchAdapter.class);

    @Override
    public void dispatch(Assignment assignment) {
        if (assignment.hostless()) {
            log.info("dispatch {} (hostless)", assignment.entry());
        } else {
            log.info("dispatch {} on {}", assignment.entry(), assignment.host().hostname());
        }
    }
}
