package com.docflow.workflow.gateway;

import com.docflow.workflow.model.ScheduledTimeoutCheck;
import com.docflow.workflow.repository.ScheduledTimeoutCheckRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Stores each check as a row in scheduled_timeout_checks. The row commits
 * with the workflow transaction that scheduled it; {@code TimeoutCheckPoller}
 * drains due rows.
 */
@Component
public class DatabaseDeferredTaskScheduler implements DeferredTaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(DatabaseDeferredTaskScheduler.class);

    private final ScheduledTimeoutCheckRepository checks;

    public DatabaseDeferredTaskScheduler(ScheduledTimeoutCheckRepository checks) {
        this.checks = checks;
    }

    @Override
    public void scheduleTimeoutCheck(Instant dueAt, TimeoutCheck check) {
        checks.save(new ScheduledTimeoutCheck(check.instanceId(), check.stepOrder(), check.stepName(), dueAt));
        log.info("Timeout check scheduled for instance {} step '{}' at {}",
                check.instanceId(), check.stepName(), dueAt);
    }
}
