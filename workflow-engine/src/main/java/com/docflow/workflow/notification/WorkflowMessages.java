package com.docflow.workflow.notification;

import com.docflow.workflow.instance.StatusCounts;
import com.docflow.workflow.instance.WorkflowStatistics;
import com.docflow.workflow.model.NotificationType;
import com.docflow.workflow.model.WorkflowInstance;
import com.docflow.workflow.model.WorkflowStatus;
import com.docflow.workflow.model.WorkflowStep;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Subject/body templates for every workflow notification.
 */
final class WorkflowMessages {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private WorkflowMessages() {}

    static WorkflowNotice started(WorkflowInstance instance) {
        String body = "Your workflow for document " + instance.getDocumentId() + " has been started.\n\n"
                + "Workflow: " + instance.getDefinition().getName() + "\n"
                + "Started by: " + instance.getStartedBy() + "\n"
                + "Started on: " + format(instance.getStartedOn());
        return new WorkflowNotice(WorkflowEvent.STARTED, NotificationType.INFO,
                "Workflow Started: " + instance.getDocumentId(), body);
    }

    static WorkflowNotice stepAssigned(WorkflowInstance instance, WorkflowStep step, Optional<Instant> deadline) {
        StringBuilder body = new StringBuilder()
                .append("You have been assigned to the step '").append(step.getStepName())
                .append("' in the workflow for document ").append(instance.getDocumentId()).append(".\n\n")
                .append("Step Description: ")
                .append(step.getDescription() == null ? "No description provided" : step.getDescription()).append('\n')
                .append("Step Type: ").append(step.getStepType()).append("\n\n");
        deadline.ifPresent(d -> body.append("Please complete this step by ").append(format(d)).append(".\n\n"));
        body.append("Please review and take necessary action.");
        return new WorkflowNotice(WorkflowEvent.STEP_ASSIGNED, NotificationType.ALERT,
                "Workflow Step Assigned: " + step.getStepName(), body.toString());
    }

    static WorkflowNotice stepCompleted(WorkflowInstance instance, WorkflowStep completed, WorkflowStep next,
                                        String actor, String comment) {
        String body = "The step '" + completed.getStepName() + "' in the workflow for document "
                + instance.getDocumentId() + " has been completed by " + actor + ".\n\n"
                + commentLine("Comment", comment)
                + "The next step '" + next.getStepName() + "' is now ready for action.";
        return new WorkflowNotice(WorkflowEvent.STEP_COMPLETED, NotificationType.INFO,
                "Workflow Step Completed: " + completed.getStepName(), body);
    }

    static WorkflowNotice actionTaken(WorkflowInstance instance, String action, String actor,
                                      String comment, String currentStepName) {
        String body = "The action '" + action + "' has been taken on the workflow for document "
                + instance.getDocumentId() + " by " + actor + ".\n\n"
                + commentLine("Comment", comment)
                + "Current Step: " + currentStepName;
        return new WorkflowNotice(WorkflowEvent.ACTION_TAKEN, NotificationType.INFO,
                "Workflow " + action + ": " + instance.getDocumentId(), body);
    }

    static WorkflowNotice completed(WorkflowInstance instance) {
        String body = "The workflow for document " + instance.getDocumentId() + " has been completed.\n\n"
                + "Completed by: " + instance.getCompletedBy() + "\n"
                + "Completed on: " + format(instance.getCompletedOn()) + "\n\n"
                + "The document status has been updated to 'Approved'.";
        return new WorkflowNotice(WorkflowEvent.COMPLETED, NotificationType.SUCCESS,
                "Workflow Completed: " + instance.getDocumentId(), body);
    }

    static WorkflowNotice rejected(WorkflowInstance instance, String actor, String comment) {
        String body = "The workflow for document " + instance.getDocumentId() + " has been rejected by "
                + actor + ".\n\n"
                + commentLine("Reason", comment)
                + "The document status has been updated to 'Rejected'.";
        return new WorkflowNotice(WorkflowEvent.REJECTED, NotificationType.WARNING,
                "Workflow Rejected: " + instance.getDocumentId(), body);
    }

    static WorkflowNotice cancelled(WorkflowInstance instance, String actor, String comment) {
        String body = "The workflow for document " + instance.getDocumentId() + " has been cancelled by "
                + actor + ".\n\n"
                + commentLine("Reason", comment)
                + "The document status has been updated to 'Cancelled'.";
        return new WorkflowNotice(WorkflowEvent.CANCELLED, NotificationType.WARNING,
                "Workflow Cancelled: " + instance.getDocumentId(), body);
    }

    static WorkflowNotice onHold(WorkflowInstance instance, String actor, String comment) {
        String body = "The workflow for document " + instance.getDocumentId()
                + " has been put on hold by " + actor + ".\n\n"
                + commentLine("Reason", comment).stripTrailing();
        return new WorkflowNotice(WorkflowEvent.ON_HOLD, NotificationType.WARNING,
                "Workflow On Hold: " + instance.getDocumentId(), body.stripTrailing());
    }

    static WorkflowNotice resumed(WorkflowInstance instance, String actor) {
        return new WorkflowNotice(WorkflowEvent.RESUMED, NotificationType.INFO,
                "Workflow Resumed: " + instance.getDocumentId(),
                "The workflow for document " + instance.getDocumentId() + " has been resumed by " + actor + ".");
    }

    static WorkflowNotice reassigned(WorkflowInstance instance, WorkflowStep step, String actor) {
        return new WorkflowNotice(WorkflowEvent.REASSIGNED, NotificationType.ALERT,
                "Workflow Step Reassigned: " + step.getStepName(),
                "The step '" + step.getStepName() + "' in the workflow for document "
                        + instance.getDocumentId() + " has been reassigned to you by " + actor + ".\n\n"
                        + "Please review and take necessary action.");
    }

    static WorkflowNotice stepTimeout(WorkflowInstance instance, WorkflowStep step) {
        return new WorkflowNotice(WorkflowEvent.STEP_TIMEOUT, NotificationType.WARNING,
                "Workflow Step Timeout: " + step.getStepName(),
                "The step '" + step.getStepName() + "' in the workflow for document "
                        + instance.getDocumentId() + " has timed out.\n\n"
                        + "Please complete this step as soon as possible or request an extension if needed.");
    }

    static WorkflowNotice escalation(WorkflowInstance instance, WorkflowStep step) {
        return new WorkflowNotice(WorkflowEvent.ESCALATION, NotificationType.ALERT,
                "Workflow Step Escalation: " + step.getStepName(),
                "The step '" + step.getStepName() + "' in the workflow for document "
                        + instance.getDocumentId() + " requires escalation.\n\n"
                        + "The step has timed out and needs immediate attention.\n\n"
                        + "Please take appropriate action.");
    }

    static WorkflowNotice reminder(WorkflowInstance instance, WorkflowStep step, long daysUntilTimeout) {
        return new WorkflowNotice(WorkflowEvent.REMINDER, NotificationType.INFO,
                "Workflow Step Reminder: " + step.getStepName(),
                "This is a reminder that the step '" + step.getStepName() + "' in the workflow for document "
                        + instance.getDocumentId() + " will timeout in " + daysUntilTimeout + " days.\n\n"
                        + "Please complete this step as soon as possible.");
    }

    static WorkflowNotice dailySummary(List<SummaryLine> lines) {
        StringBuilder body = new StringBuilder("Here is your daily workflow summary:\n\n");
        for (SummaryLine line : lines) {
            body.append("- Document: ").append(line.documentId()).append('\n')
                .append("  Workflow: ").append(line.workflowName()).append('\n')
                .append("  Current Step: ").append(line.currentStep()).append('\n')
                .append("  Status: ").append(line.status()).append("\n\n");
        }
        body.append("Please review and take necessary action.");
        return new WorkflowNotice(WorkflowEvent.DAILY_SUMMARY, NotificationType.INFO,
                "Daily Workflow Summary", body.toString());
    }

    static WorkflowNotice digest(String frequency, WorkflowStatistics stats) {
        StringBuilder body = new StringBuilder("Here is your ").append(frequency.toLowerCase())
                .append(" workflow digest:\n\n");
        appendCounts(body, "", "Total Workflows", stats.overall(), WorkflowStatus.values());
        for (Map.Entry<String, StatusCounts> e : stats.byDefinition().entrySet()) {
            body.append('\n').append(e.getKey()).append(":\n");
            appendCounts(body, "  ", "Total", e.getValue(), new WorkflowStatus[] {
                    WorkflowStatus.IN_PROGRESS, WorkflowStatus.COMPLETED, WorkflowStatus.REJECTED });
        }
        return new WorkflowNotice(WorkflowEvent.DIGEST, NotificationType.INFO,
                capitalize(frequency) + " Workflow Digest", body.toString().stripTrailing());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void appendCounts(StringBuilder body, String indent, String totalLabel,
                                     StatusCounts counts, WorkflowStatus[] statuses) {
        body.append(indent).append(totalLabel).append(": ").append(counts.total()).append('\n');
        for (WorkflowStatus status : statuses) {
            body.append(indent).append(status.label()).append(": ").append(counts.count(status)).append('\n');
        }
    }

    private static String commentLine(String label, String comment) {
        return comment == null || comment.isBlank() ? "" : label + ": " + comment + "\n\n";
    }

    private static String format(Instant instant) {
        return instant == null ? "-" : TIMESTAMP.format(instant);
    }

    private static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return Character.toUpperCase(s.charAt(0)) + s.substring(1).toLowerCase();
    }
}
