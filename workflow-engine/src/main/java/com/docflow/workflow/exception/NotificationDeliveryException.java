package com.docflow.workflow.exception;

/**
 * Delivery through a notification transport failed. The dispatcher logs
 * these and never lets them reach the workflow operation.
 */
public class NotificationDeliveryException extends WorkflowException {

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
