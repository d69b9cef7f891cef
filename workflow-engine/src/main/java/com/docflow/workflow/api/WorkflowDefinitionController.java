package com.docflow.workflow.api;

import com.docflow.workflow.api.dto.DefinitionRequest;
import com.docflow.workflow.api.dto.DefinitionResponse;
import com.docflow.workflow.definition.ConditionTestResult;
import com.docflow.workflow.definition.WorkflowDefinitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for authoring workflow definitions.
 *
 * GET  /workflows/definitions                         list (filter by documentType, activeOnly)
 * POST /workflows/definitions                         create
 * GET  /workflows/definitions/{name}                  fetch one
 * PUT  /workflows/definitions/{name}                  replace content (inactive definitions only)
 * POST /workflows/definitions/{name}/activate|deactivate|duplicate
 * GET  /workflows/definitions/{name}/conditions/test  evaluate condition groups against a document
 */
@RestController
@RequestMapping("/workflows/definitions")
public class WorkflowDefinitionController {

    private final WorkflowDefinitionService definitionService;

    public WorkflowDefinitionController(WorkflowDefinitionService definitionService) {
        this.definitionService = definitionService;
    }

    @GetMapping
    public List<DefinitionResponse> list(@RequestParam(required = false) String documentType,
                                         @RequestParam(defaultValue = "false") boolean activeOnly) {
        return definitionService.list(documentType, activeOnly).stream()
                .map(DefinitionResponse::from)
                .toList();
    }

    @PostMapping
    public ResponseEntity<DefinitionResponse> create(@RequestBody DefinitionRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DefinitionResponse.from(definitionService.create(req.toEntity())));
    }

    @GetMapping("/{name}")
    public DefinitionResponse get(@PathVariable String name) {
        return DefinitionResponse.from(definitionService.get(name));
    }

    @PutMapping("/{name}")
    public DefinitionResponse update(@PathVariable String name, @RequestBody DefinitionRequest req) {
        return DefinitionResponse.from(definitionService.update(name, req.toEntity()));
    }

    @PostMapping("/{name}/activate")
    public DefinitionResponse activate(@PathVariable String name) {
        return DefinitionResponse.from(definitionService.activate(name));
    }

    @PostMapping("/{name}/deactivate")
    public DefinitionResponse deactivate(@PathVariable String name) {
        return DefinitionResponse.from(definitionService.deactivate(name));
    }

    @PostMapping("/{name}/duplicate")
    public ResponseEntity<DefinitionResponse> duplicate(@PathVariable String name) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DefinitionResponse.from(definitionService.duplicate(name)));
    }

    @GetMapping("/{name}/conditions/test")
    public ConditionTestResult testConditions(@PathVariable String name, @RequestParam String documentId) {
        return definitionService.testConditions(name, documentId);
    }
}
