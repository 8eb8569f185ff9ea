package com.healthbud.errors;

/**
 * Provider answered with a non-2xx status.
 */
public class ProviderHttpException extends RecoverableAssessmentException {

    private final int statusCode;
    private final String responseBody;

    public ProviderHttpException(String provider, int statusCode, String responseBody) {
        super(provider + " HTTP error: " + statusCode + " " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
