package com.example.invoicepipeline.infrastructure.exception;

/**
 * Failure of an output adapter (file system, JSON serialization) after extraction succeeded.
 * The code identifies the adapter step so batch summaries can report it next to extraction codes.
 */
public abstract class InfrastructureException extends RuntimeException {

    private final String errorCode;

	/**
	 * @param errorCode stable code of the failing step
	 * @param message   context about the failure
	 * @param cause     exception raised by the underlying library
	 */
    protected InfrastructureException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
