package com.example.invoicepipeline.domain.exception;

/**
 * Machine-readable codes carried by {@link InvoiceExtractionException}.
 * Callers bucket failed documents by these codes without aborting a batch.
 */
public enum ExtractionErrorCode {
    /** The document conversion step succeeded but produced no text. */
    CONVERSION_EMPTY_CONTENT,
    /** The document conversion step raised. */
    CONVERSION_FAILURE,
    /** The source document reference does not resolve to readable content. */
    INPUT_MISSING,
    /** Conversion succeeded but no line matched the row grammar. */
    PARSER_EMPTY_RESULT
}
