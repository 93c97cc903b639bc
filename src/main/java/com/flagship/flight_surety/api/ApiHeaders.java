package com.flagship.flight_surety.api;

/**
 * Request headers understood by the REST boundary.
 */
public final class ApiHeaders {

    /**
     * Account on whose behalf the request is made.
     */
    public static final String ACCOUNT_ID = "X-Account-Id";

    private ApiHeaders() {
    }
}
