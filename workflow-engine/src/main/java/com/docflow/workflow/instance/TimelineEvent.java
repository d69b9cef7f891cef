package com.docflow.workflow.instance;

import java.time.Instant;

public record TimelineEvent(Instant timestamp, String event, String actor, String description) {}
