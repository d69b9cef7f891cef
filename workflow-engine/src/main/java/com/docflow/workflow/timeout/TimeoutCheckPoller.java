package com.docflow.workflow.timeout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background loop that drains due timeout checks.
 *
 * The scheduled_timeout_checks table is the queue; each tick claims up to
 * one batch. fixedDelay waits for the previous tick to finish, so ticks
 * never overlap on one node.
 */
@Component
@EnableScheduling
public class TimeoutCheckPoller {

    private static final Logger log = LoggerFactory.getLogger(TimeoutCheckPoller.class);

    private final TimeoutCheckQueue queue;

    public TimeoutCheckPoller(TimeoutCheckQueue queue) {
        this.queue = queue;
    }

    @Scheduled(fixedDelayString = "${docflow.timeouts.poll-interval-ms:60000}")
    public void tick() {
        try {
            queue.fireDueChecks();
        } catch (Exception e) {
            log.error("Timeout poll failed: {}", e.getMessage(), e);
        }
    }
}
