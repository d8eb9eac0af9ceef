package com.example.invoicepipeline.domain.model;

import java.util.List;

/**
 * Domain DTO containing the metadata and detail rows extracted from one invoice document.
 * Returned from {@code InvoiceParsingService} to controllers and the batch run.
 */
public record InvoiceExtractionResult(
        String sourceName,
        int paragraphCount,
        InvoiceMetadata metadata,
        List<LineItemRow> rows
) {

    public InvoiceExtractionResult {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
