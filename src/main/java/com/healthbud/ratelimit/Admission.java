package com.healthbud.ratelimit;

/**
 * Outcome of an admission check. A rejection is a normal result, not a failure.
 */
public enum Admission {
    ADMITTED,
    REJECTED;

    public boolean isAdmitted() {
        return this == ADMITTED;
    }
}
