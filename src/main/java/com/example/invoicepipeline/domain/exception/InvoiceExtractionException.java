package com.example.invoicepipeline.domain.exception;

/**
 * The single failure type raised by the extraction engine.
 * Missing metadata fields are never reported through this exception; they surface as absent values.
 */
public class InvoiceExtractionException extends DomainException {

    private final ExtractionErrorCode code;

	/**
	 * Creates the exception for a failure without an underlying cause.
	 *
	 * @param code    machine-readable failure code
	 * @param message human readable explanation
	 */
    public InvoiceExtractionException(ExtractionErrorCode code, String message) {
        super(message);
        this.code = code;
    }

	/**
	 * Creates the exception and preserves the root cause.
	 *
	 * @param code    machine-readable failure code
	 * @param message human readable explanation
	 * @param cause   exception raised by a collaborator
	 */
    public InvoiceExtractionException(ExtractionErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ExtractionErrorCode getCode() {
        return code;
    }

    @Override
    public String errorCode() {
        return code.name();
    }

    public static InvoiceExtractionException inputMissing(String reference) {
        return new InvoiceExtractionException(ExtractionErrorCode.INPUT_MISSING,
                "Invoice document not found or unreadable: " + reference);
    }

    public static InvoiceExtractionException emptyContent(String sourceName) {
        return new InvoiceExtractionException(ExtractionErrorCode.CONVERSION_EMPTY_CONTENT,
                "Document conversion produced no text for " + sourceName);
    }

    public static InvoiceExtractionException conversionFailure(String sourceName, Throwable cause) {
        return new InvoiceExtractionException(ExtractionErrorCode.CONVERSION_FAILURE,
                "Unable to convert " + sourceName + ": " + cause.getMessage(), cause);
    }

    public static InvoiceExtractionException unsupportedFormat(String sourceName) {
        return new InvoiceExtractionException(ExtractionErrorCode.CONVERSION_FAILURE,
                "No document converter accepts " + sourceName);
    }

    public static InvoiceExtractionException emptyResult(String sourceName) {
        return new InvoiceExtractionException(ExtractionErrorCode.PARSER_EMPTY_RESULT,
                "No detail rows matched in " + sourceName);
    }
}
