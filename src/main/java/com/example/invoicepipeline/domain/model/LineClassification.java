package com.example.invoicepipeline.domain.model;

/**
 * Outcome of classifying a single normalized line of the detail table.
 */
public enum LineClassification {
    /** Repeated column-title banner of the itemized table. */
    HEADER_BANNER,
    /** Line made of a single numeric token (running or final total). */
    SUBTOTAL,
    /** Line matching the complete row grammar. */
    DETAIL_ROW,
    NOISE
}
