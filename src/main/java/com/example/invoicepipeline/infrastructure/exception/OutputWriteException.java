package com.example.invoicepipeline.infrastructure.exception;

/**
 * Signals that extracted rows could not be written to the output location.
 */
public class OutputWriteException extends InfrastructureException {

    public static final String ERROR_CODE = "OUTPUT_WRITE_FAILURE";

    public OutputWriteException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
