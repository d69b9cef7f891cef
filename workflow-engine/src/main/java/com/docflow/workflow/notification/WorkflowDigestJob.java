package com.docflow.workflow.notification;

import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.instance.WorkflowInstanceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic summaries: a statistics digest for one role and a per-user
 * daily summary of the steps waiting on them.
 *
 * Both crons default to "-", which leaves the job unscheduled.
 */
@Component
public class WorkflowDigestJob {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDigestJob.class);

    private final WorkflowInstanceService instances;
    private final NotificationDispatcher  notifications;
    private final IdentityDirectory       identity;
    private final String                  digestRole;
    private final String                  digestFrequency;

    public WorkflowDigestJob(WorkflowInstanceService instances,
                             NotificationDispatcher notifications,
                             IdentityDirectory identity,
                             @Value("${docflow.notifications.digest-role:System Manager}") String digestRole,
                             @Value("${docflow.notifications.digest-frequency:daily}") String digestFrequency) {
        this.instances       = instances;
        this.notifications   = notifications;
        this.identity        = identity;
        this.digestRole      = digestRole;
        this.digestFrequency = digestFrequency;
    }

    @Scheduled(cron = "${docflow.notifications.digest-cron:-}")
    public void sendDigest() {
        try {
            notifications.sendDigest(digestRole, digestFrequency, instances.statistics(null));
            log.info("Sent {} workflow digest to role '{}'", digestFrequency, digestRole);
        } catch (Exception e) {
            log.error("Workflow digest failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${docflow.notifications.summary-cron:-}")
    public void sendDailySummaries() {
        int sent = 0;
        for (String user : identity.enabledUsers()) {
            try {
                List<SummaryLine> lines = instances.dailySummaryFor(user);
                if (lines.isEmpty()) continue;
                notifications.sendDailySummary(user, lines);
                sent++;
            } catch (Exception e) {
                log.warn("Daily summary for {} failed: {}", user, e.getMessage());
            }
        }
        log.info("Daily workflow summaries sent to {} user(s)", sent);
    }
}
