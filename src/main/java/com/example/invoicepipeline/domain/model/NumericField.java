package com.example.invoicepipeline.domain.model;

/**
 * Numeric columns of a detail row, in grammar order.
 */
public enum NumericField {
    QUANTITY_AMOUNT,
    RATE,
    CHARGE,
    TAX_AMOUNT,
    TOTAL_CHARGE
}
