package com.example.invoicepipeline.application.exception;

/**
 * Rejection of a request by an application service, such as an export without rows.
 * Carries the code returned to HTTP clients in the error payload.
 */
public abstract class ApplicationException extends RuntimeException {

    private final String errorCode;

	/**
	 * @param errorCode stable code surfaced to the caller
	 * @param message   human readable explanation suitable for surfacing to the caller
	 */
    protected ApplicationException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
