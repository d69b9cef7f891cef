package com.docflow.workflow.model;

/** Severity tag stored with each in-app notification. */
public enum NotificationType {
    INFO,
    ALERT,
    SUCCESS,
    WARNING
}
