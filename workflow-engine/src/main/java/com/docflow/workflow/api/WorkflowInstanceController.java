package com.docflow.workflow.api;

import com.docflow.workflow.api.dto.*;
import com.docflow.workflow.instance.TimelineEvent;
import com.docflow.workflow.instance.WorkflowInstanceService;
import com.docflow.workflow.instance.WorkflowStatistics;
import com.docflow.workflow.model.WorkflowInstance;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * REST API for workflow instances.
 *
 * The acting user is taken from the X-Docflow-User header on every call.
 *
 * POST /workflows/instances                         start a workflow for a document
 * GET  /workflows/instances/{id}                    current state
 * POST /workflows/instances/{id}/actions            approve / reject / request changes / forward / skip
 * POST /workflows/instances/{id}/cancel|hold|resume|resubmit|reassign|reminder
 * GET  /workflows/instances/{id}/history|timeline|path|participants|actions
 * GET  /workflows/documents/{documentId}/status     latest instance of a document
 * GET  /workflows/pending                           instances waiting on the caller
 * GET  /workflows/statistics                        counts by status
 */
@RestController
@RequestMapping("/workflows")
public class WorkflowInstanceController {

    static final String USER_HEADER = "X-Docflow-User";

    private final WorkflowInstanceService instanceService;

    public WorkflowInstanceController(WorkflowInstanceService instanceService) {
        this.instanceService = instanceService;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Start a workflow.
     *
     * Example:
     *   curl -X POST http://localhost:8080/workflows/instances \
     *     -H "Content-Type: application/json" -H "X-Docflow-User: alice" \
     *     -d '{"documentId":"PO-0001"}'
     */
    @PostMapping("/instances")
    public ResponseEntity<InstanceResponse> start(@RequestHeader(USER_HEADER) String user,
                                                  @RequestBody StartWorkflowRequest req) {
        WorkflowInstance instance = instanceService.startWorkflow(req.documentId(), req.workflowName(), user);
        return ResponseEntity.status(HttpStatus.CREATED).body(InstanceResponse.from(instance));
    }

    @GetMapping("/instances/{id}")
    public InstanceResponse get(@PathVariable UUID id) {
        return InstanceResponse.from(instanceService.get(id));
    }

    @PostMapping("/instances/{id}/actions")
    public InstanceResponse executeAction(@PathVariable UUID id,
                                          @RequestHeader(USER_HEADER) String user,
                                          @RequestBody ActionRequest req) {
        return InstanceResponse.from(
                instanceService.executeAction(id, req.action(), user, req.comment(), req.targetStep()));
    }

    @PostMapping("/instances/{id}/cancel")
    public InstanceResponse cancel(@PathVariable UUID id,
                                   @RequestHeader(USER_HEADER) String user,
                                   @RequestBody(required = false) CommentRequest req) {
        return InstanceResponse.from(instanceService.cancel(id, user, comment(req)));
    }

    @PostMapping("/instances/{id}/hold")
    public InstanceResponse hold(@PathVariable UUID id,
                                 @RequestHeader(USER_HEADER) String user,
                                 @RequestBody(required = false) CommentRequest req) {
        return InstanceResponse.from(instanceService.hold(id, user, comment(req)));
    }

    @PostMapping("/instances/{id}/resume")
    public InstanceResponse resume(@PathVariable UUID id,
                                   @RequestHeader(USER_HEADER) String user,
                                   @RequestBody(required = false) CommentRequest req) {
        return InstanceResponse.from(instanceService.resume(id, user, comment(req)));
    }

    @PostMapping("/instances/{id}/resubmit")
    public InstanceResponse resubmit(@PathVariable UUID id,
                                     @RequestHeader(USER_HEADER) String user,
                                     @RequestBody(required = false) CommentRequest req) {
        return InstanceResponse.from(instanceService.resubmit(id, user, comment(req)));
    }

    @PostMapping("/instances/{id}/reassign")
    public InstanceResponse reassign(@PathVariable UUID id,
                                     @RequestHeader(USER_HEADER) String user,
                                     @RequestBody ReassignRequest req) {
        return InstanceResponse.from(instanceService.reassign(id, req.assignee(), user, req.comment()));
    }

    /**
     * Send a deadline reminder to the current step's assignees.
     *
     * HTTP 202: reminder sent
     * HTTP 204: nothing to remind about (no deadline, or it is less than a day away)
     */
    @PostMapping("/instances/{id}/reminder")
    public ResponseEntity<Void> reminder(@PathVariable UUID id) {
        return instanceService.sendReminder(id)
                ? ResponseEntity.accepted().build()
                : ResponseEntity.noContent().build();
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    @GetMapping("/instances/{id}/history")
    public List<HistoryEntryResponse> history(@PathVariable UUID id) {
        return instanceService.history(id).stream()
                .map(HistoryEntryResponse::from)
                .toList();
    }

    @GetMapping("/instances/{id}/timeline")
    public List<TimelineEvent> timeline(@PathVariable UUID id) {
        return instanceService.timeline(id);
    }

    @GetMapping("/instances/{id}/path")
    public List<PathStepResponse> path(@PathVariable UUID id) {
        return instanceService.path(id).stream()
                .map(PathStepResponse::from)
                .toList();
    }

    @GetMapping("/instances/{id}/participants")
    public Set<String> participants(@PathVariable UUID id) {
        return instanceService.participants(id);
    }

    /** Action names the caller may take right now. */
    @GetMapping("/instances/{id}/actions")
    public List<String> availableActions(@PathVariable UUID id,
                                         @RequestHeader(USER_HEADER) String user) {
        return instanceService.availableActions(id, user);
    }

    /**
     * Latest instance of a document.
     * Returns 200 with {"status":"Not Started"} when the document never had a workflow.
     */
    @GetMapping("/documents/{documentId}/status")
    public ResponseEntity<?> documentStatus(@PathVariable String documentId) {
        return instanceService.statusForDocument(documentId)
                .<ResponseEntity<?>>map(i -> ResponseEntity.ok(InstanceResponse.from(i)))
                .orElseGet(() -> ResponseEntity.ok(Map.of("documentId", documentId, "status", "Not Started")));
    }

    @GetMapping("/pending")
    public List<PendingActionResponse> pending(@RequestHeader(USER_HEADER) String user) {
        return instanceService.pendingActions(user).stream()
                .map(PendingActionResponse::from)
                .toList();
    }

    @GetMapping("/statistics")
    public WorkflowStatistics statistics(@RequestParam(required = false) String documentType) {
        return instanceService.statistics(documentType);
    }

    private static String comment(CommentRequest req) {
        return req == null ? null : req.comment();
    }
}
