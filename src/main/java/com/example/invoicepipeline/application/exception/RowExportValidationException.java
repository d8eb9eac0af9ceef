package com.example.invoicepipeline.application.exception;

/**
 * Raised when an export is requested for a row set that cannot be exported.
 */
public class RowExportValidationException extends ApplicationException {

    public static final String ERROR_CODE = "ROW_EXPORT_VALIDATION_ERROR";

	/**
	 * @param message validation message suitable for display
	 */
    public RowExportValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
