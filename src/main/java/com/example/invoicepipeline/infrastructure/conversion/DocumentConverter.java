package com.example.invoicepipeline.infrastructure.conversion;

import com.example.invoicepipeline.domain.model.InvoiceDocument;

/**
 * Turns the bytes of an invoice document into paragraph-structured text.
 * Implementations raise {@code InvoiceExtractionException} with {@code CONVERSION_FAILURE} when the content cannot be
 * read; an empty but successful conversion is returned as an empty document and judged by the caller.
 */
public interface DocumentConverter {

    /**
     * @param fileName    original file name, may be {@code null}
     * @param contentType declared MIME type, may be {@code null}
     * @return {@code true} when this converter handles the document
     */
    boolean supports(String fileName, String contentType);

    /**
     * @param content    raw document bytes
     * @param sourceName logical name used in logs and results
     * @return converted document, paragraphs in reading order
     */
    InvoiceDocument convert(byte[] content, String sourceName);
}
