package com.healthbud.errors;

/**
 * Transport-level failure: DNS, refused connection, timeout or an abandoned call.
 */
public class ProviderNetworkException extends RecoverableAssessmentException {

    public ProviderNetworkException(String provider, String reason, Throwable cause) {
        super(provider + " network error: " + reason, cause);
    }
}
