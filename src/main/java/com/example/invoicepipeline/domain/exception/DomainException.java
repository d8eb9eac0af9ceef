package com.example.invoicepipeline.domain.exception;

/**
 * Root of the failures raised while turning one invoice document into rows.
 * Every subtype exposes a stable code so callers can bucket failed documents and keep going.
 */
public abstract class DomainException extends RuntimeException {

	/**
	 * @param message what went wrong with the document
	 */
    protected DomainException(String message) {
        super(message);
    }

	/**
	 * @param message what went wrong with the document
	 * @param cause   collaborator failure behind it
	 */
    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return stable, machine-readable failure code
     */
    public abstract String errorCode();
}
