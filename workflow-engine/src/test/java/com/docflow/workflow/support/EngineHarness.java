package com.docflow.workflow.support;

import com.docflow.workflow.action.ActionEngine;
import com.docflow.workflow.assignee.DepartmentHeadResolver;
import com.docflow.workflow.assignee.DocumentOwnerResolver;
import com.docflow.workflow.assignee.DynamicAssigneeRegistry;
import com.docflow.workflow.condition.ConditionEvaluator;
import com.docflow.workflow.gateway.*;
import com.docflow.workflow.instance.StepProcessor;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.notification.NotificationDispatcher;
import com.docflow.workflow.repository.WorkflowInstanceRepository;
import com.docflow.workflow.routing.RoutingResolver;
import com.docflow.workflow.statemachine.WorkflowStateMachine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The engine wired by hand: real routing, state machine, step processing,
 * actions and notification composition over mocked persistence and
 * delivery ports and an in-memory document store.
 */
public class EngineHarness {

    public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    public final Clock                      clock         = Clock.fixed(NOW, ZoneOffset.UTC);
    public final SimpleMeterRegistry        meterRegistry = new SimpleMeterRegistry();
    public final ConfiguredIdentityDirectory identity     = TestWorkflows.identity();
    public final InMemoryDocuments          documents     = new InMemoryDocuments();

    public final WorkflowInstanceRepository instances  = mock(WorkflowInstanceRepository.class);
    public final NotificationTransport      transport  = mock(NotificationTransport.class);
    public final WorkItemService            workItems  = mock(WorkItemService.class);
    public final DeferredTaskScheduler      scheduler  = mock(DeferredTaskScheduler.class);
    public final CommentDirectory           comments   = mock(CommentDirectory.class);

    public final ConditionEvaluator      conditions;
    public final DynamicAssigneeRegistry registry;
    public final RoutingResolver         routing;
    public final NotificationDispatcher  notifications;
    public final StepProcessor           stepProcessor;
    public final WorkflowStateMachine    stateMachine;
    public final ActionEngine            actions;

    public EngineHarness() {
        conditions    = new ConditionEvaluator();
        registry      = new DynamicAssigneeRegistry(
                List.of(new DocumentOwnerResolver(identity), new DepartmentHeadResolver(identity)), meterRegistry);
        routing       = new RoutingResolver(conditions, identity, documents, registry);
        notifications = new NotificationDispatcher(transport, routing, identity, comments, meterRegistry, "System Manager");
        stepProcessor = new StepProcessor(routing, workItems, scheduler, notifications, clock);
        stateMachine  = new WorkflowStateMachine(stepProcessor, routing, documents, notifications, meterRegistry, clock);
        actions       = new ActionEngine(instances, routing, stateMachine, stepProcessor, notifications, meterRegistry);

        when(instances.save(any(WorkflowInstance.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    /** Makes the instance loadable by id, the way the locking query would return it. */
    public WorkflowInstance store(WorkflowInstance instance) {
        when(instances.findByIdForUpdate(instance.getId())).thenReturn(Optional.of(instance));
        when(instances.findById(instance.getId())).thenReturn(Optional.of(instance));
        return instance;
    }

    public double counter(String name, String... tags) {
        var counter = meterRegistry.find(name).tags(tags).counter();
        return counter == null ? 0 : counter.count();
    }
}
