package com.healthbud.errors;

/**
 * Base of every failure that is answered with the deterministic fallback assessment
 * instead of an error. Anything outside this hierarchy is a programming error.
 */
public abstract class RecoverableAssessmentException extends Exception {

    protected RecoverableAssessmentException(String message) {
        super(message);
    }

    protected RecoverableAssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
