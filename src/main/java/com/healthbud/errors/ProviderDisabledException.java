package com.healthbud.errors;

public class ProviderDisabledException extends RecoverableAssessmentException {

    public ProviderDisabledException(String provider) {
        super(provider + " API key is not configured");
    }
}
