package com.casesentinel.core.alert;

/**
 * A detection result lacks a value its alert template needs. The whole batch
 * is rejected rather than writing a malformed alert.
 *
 * @since 1.0.0
 */
public class AlertFormattingException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public AlertFormattingException(String message) {
        super(message);
    }
}
