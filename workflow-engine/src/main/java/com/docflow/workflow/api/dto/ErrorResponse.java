package com.docflow.workflow.api.dto;

import java.util.List;

/** Body of every non-2xx response produced by the exception advice. */
public record ErrorResponse(int status, String error, String message, List<String> problems) {

    public ErrorResponse(int status, String error, String message) {
        this(status, error, message, List.of());
    }
}
