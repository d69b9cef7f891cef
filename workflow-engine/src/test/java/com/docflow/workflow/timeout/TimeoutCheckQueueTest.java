package com.docflow.workflow.timeout;

import com.docflow.workflow.model.ScheduledTimeoutCheck;
import com.docflow.workflow.repository.ScheduledTimeoutCheckRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeoutCheckQueueTest {

    static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @Mock ScheduledTimeoutCheckRepository checks;
    @Mock StepTimeoutHandler              handler;

    TimeoutCheckQueue queue;

    @BeforeEach
    void setUp() {
        queue = new TimeoutCheckQueue(checks, handler, Clock.fixed(NOW, ZoneOffset.UTC), 25);
    }

    @Test
    void fireDueChecks_stampsEachCheckAndCountsApplied() {
        ScheduledTimeoutCheck live  = new ScheduledTimeoutCheck(UUID.randomUUID(), 2, "Manager Approval", NOW.minusSeconds(60));
        ScheduledTimeoutCheck stale = new ScheduledTimeoutCheck(UUID.randomUUID(), 3, "Finance Approval", NOW.minusSeconds(30));
        when(checks.claimDue(NOW, PageRequest.of(0, 25))).thenReturn(List.of(live, stale));
        when(handler.handle(live.getInstanceId(), 2, "Manager Approval")).thenReturn(true);
        when(handler.handle(stale.getInstanceId(), 3, "Finance Approval")).thenReturn(false);

        int applied = queue.fireDueChecks();

        assertThat(applied).isEqualTo(1);
        assertThat(live.getFiredAt()).isEqualTo(NOW);
        assertThat(stale.getFiredAt()).isEqualTo(NOW);
        verify(checks, times(2)).save(any(ScheduledTimeoutCheck.class));
    }

    @Test
    void failingHandler_doesNotStopTheBatch() {
        ScheduledTimeoutCheck broken = new ScheduledTimeoutCheck(UUID.randomUUID(), 2, "Manager Approval", NOW);
        ScheduledTimeoutCheck next   = new ScheduledTimeoutCheck(UUID.randomUUID(), 2, "Manager Approval", NOW);
        when(checks.claimDue(eq(NOW), any())).thenReturn(List.of(broken, next));
        when(handler.handle(broken.getInstanceId(), 2, "Manager Approval"))
                .thenThrow(new IllegalStateException("lock timeout"));
        when(handler.handle(next.getInstanceId(), 2, "Manager Approval")).thenReturn(true);

        assertThat(queue.fireDueChecks()).isEqualTo(1);
        assertThat(broken.getFiredAt()).isEqualTo(NOW);
    }

    @Test
    void nothingDue_doesNothing() {
        when(checks.claimDue(eq(NOW), any())).thenReturn(List.of());

        assertThat(queue.fireDueChecks()).isZero();
        verifyNoInteractions(handler);
    }
}
