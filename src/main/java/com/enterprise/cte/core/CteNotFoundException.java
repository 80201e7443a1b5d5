package com.enterprise.cte.core;

/**
 * The requested target is not a key of the supplied mapping.
 */
public class CteNotFoundException extends CteResolutionException {

    public CteNotFoundException(String cteName) {
        super(cteName, "CTE not found: " + cteName);
    }
}
