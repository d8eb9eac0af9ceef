package com.example.invoicepipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * Detail row stamped with provenance fields by the batch run before it is persisted.
 * Serializes as the flat row object followed by {@code file_id}, {@code file_name} and {@code processing_timestamp}.
 */
@JsonPropertyOrder({"row", "file_id", "file_name", "processing_timestamp"})
public record EnrichedInvoiceRow(
        @JsonUnwrapped LineItemRow row,
        @JsonProperty("file_id") String fileId,
        @JsonProperty("file_name") String fileName,
        @JsonProperty("processing_timestamp") String processingTimestamp
) {
}
