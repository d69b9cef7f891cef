package com.docflow.workflow.timeout;

import com.docflow.workflow.model.ScheduledTimeoutCheck;
import com.docflow.workflow.repository.ScheduledTimeoutCheckRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Claims due timeout checks and hands them to {@link StepTimeoutHandler}.
 *
 * Claiming is SELECT ... FOR UPDATE on the due rows plus stamping
 * fired_at in the same transaction, so two pollers never fire the same
 * check. A check fires at most once even when its handler fails.
 */
@Service
public class TimeoutCheckQueue {

    private static final Logger log = LoggerFactory.getLogger(TimeoutCheckQueue.class);

    private final ScheduledTimeoutCheckRepository checks;
    private final StepTimeoutHandler              handler;
    private final Clock                           clock;
    private final int                             batchSize;

    public TimeoutCheckQueue(ScheduledTimeoutCheckRepository checks,
                             StepTimeoutHandler handler,
                             Clock clock,
                             @Value("${docflow.timeouts.batch-size:50}") int batchSize) {
        this.checks    = checks;
        this.handler   = handler;
        this.clock     = clock;
        this.batchSize = batchSize;
    }

    /** @return number of checks whose timeout applied */
    @Transactional
    public int fireDueChecks() {
        List<ScheduledTimeoutCheck> due = checks.claimDue(clock.instant(), PageRequest.of(0, batchSize));
        int applied = 0;
        for (ScheduledTimeoutCheck check : due) {
            check.setFiredAt(clock.instant());
            checks.save(check);
            try {
                if (handler.handle(check.getInstanceId(), check.getStepOrder(), check.getStepName())) {
                    applied++;
                }
            } catch (Exception e) {
                log.error("Timeout check {} for instance {} failed: {}",
                        check.getId(), check.getInstanceId(), e.getMessage(), e);
            }
        }
        if (!due.isEmpty()) {
            log.info("Fired {} timeout check(s), {} applied", due.size(), applied);
        }
        return applied;
    }
}
