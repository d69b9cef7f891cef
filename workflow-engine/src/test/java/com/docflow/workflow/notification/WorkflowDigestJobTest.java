package com.docflow.workflow.notification;

import com.docflow.workflow.gateway.IdentityDirectory;
import com.docflow.workflow.instance.StatusCounts;
import com.docflow.workflow.instance.WorkflowInstanceService;
import com.docflow.workflow.instance.WorkflowStatistics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowDigestJobTest {

    @Mock WorkflowInstanceService instances;
    @Mock NotificationDispatcher  notifications;
    @Mock IdentityDirectory       identity;

    WorkflowDigestJob job;

    @BeforeEach
    void setUp() {
        job = new WorkflowDigestJob(instances, notifications, identity, "System Manager", "weekly");
    }

    @Test
    void digest_sendsStatisticsToConfiguredRole() {
        WorkflowStatistics statistics = new WorkflowStatistics(new StatusCounts(0, Map.of()), Map.of());
        when(instances.statistics(null)).thenReturn(statistics);

        job.sendDigest();

        verify(notifications).sendDigest("System Manager", "weekly", statistics);
    }

    @Test
    void digest_failureIsContained() {
        when(instances.statistics(null)).thenThrow(new IllegalStateException("database unavailable"));

        job.sendDigest();

        verifyNoInteractions(notifications);
    }

    @Test
    void dailySummaries_onlyForUsersWithWaitingSteps() {
        List<SummaryLine> carolLines = List.of(new SummaryLine("PO-1", "PO Approval", "Finance Approval", "In Progress"));
        when(identity.enabledUsers()).thenReturn(new TreeSet<>(Set.of("bob", "carol", "dave")));
        when(instances.dailySummaryFor("bob")).thenReturn(List.of());
        when(instances.dailySummaryFor("carol")).thenReturn(carolLines);
        when(instances.dailySummaryFor("dave")).thenThrow(new IllegalStateException("boom"));

        job.sendDailySummaries();

        verify(notifications).sendDailySummary("carol", carolLines);
        verify(notifications, times(1)).sendDailySummary(anyString(), any());
    }
}
