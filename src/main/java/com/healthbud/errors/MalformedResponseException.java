package com.healthbud.errors;

/**
 * Provider output could not be turned into a usable JSON object.
 */
public class MalformedResponseException extends RecoverableAssessmentException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
