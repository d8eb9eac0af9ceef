package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.NumericField;

/**
 * Fields of the detail row grammar, in the order they appear on a line.
 */
public enum RowField {
    EVENT_CODE(null),
    DESCRIPTION(null),
    SERVICE_CODE(null),
    UOM(null),
    QUANTITY_AMOUNT(NumericField.QUANTITY_AMOUNT),
    RATE(NumericField.RATE),
    CHARGE(NumericField.CHARGE),
    TAX_AMOUNT(NumericField.TAX_AMOUNT),
    TOTAL_CHARGE(NumericField.TOTAL_CHARGE);

    private final NumericField numericField;

    RowField(NumericField numericField) {
        this.numericField = numericField;
    }

    public NumericField numericField() {
        return numericField;
    }

    public boolean isNumeric() {
        return numericField != null;
    }
}
