package com.flagship.flight_surety.common;

/**
 * Raised when a core operation rejects its call.
 */
public class SuretyException extends RuntimeException {

    private final SuretyError error;

    public SuretyException(SuretyError error, String message) {
        super(message);
        this.error = error;
    }

    public SuretyException(SuretyError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public SuretyError getError() {
        return error;
    }
}
