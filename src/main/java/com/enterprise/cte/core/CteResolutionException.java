package com.enterprise.cte.core;

/**
 * Base class for failures raised while walking a {@link CteMapping}.
 */
public class CteResolutionException extends RuntimeException {

    private final String cteName;

    protected CteResolutionException(String cteName, String message) {
        super(message);
        this.cteName = cteName;
    }

    /** The CTE the failure is about. */
    public String cteName() {
        return cteName;
    }
}
