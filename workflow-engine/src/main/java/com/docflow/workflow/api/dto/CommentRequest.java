package com.docflow.workflow.api.dto;

/** Optional free text for cancel / hold / resume / resubmit. */
public record CommentRequest(String comment) {}
