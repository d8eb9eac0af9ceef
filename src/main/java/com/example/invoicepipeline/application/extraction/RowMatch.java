package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.NumericField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of running the row grammar over one normalized line.
 * Either every field was captured, or {@link #failedField()} names the first field that could not be consumed.
 */
public final class RowMatch {

    private final String eventCode;
    private final String description;
    private final String serviceCode;
    private final String uom;
    private final Map<NumericField, String> amounts;
    private final RowField failedField;
    private final String failureReason;

    private RowMatch(String eventCode,
                     String description,
                     String serviceCode,
                     String uom,
                     Map<NumericField, String> amounts,
                     RowField failedField,
                     String failureReason) {
        this.eventCode = eventCode;
        this.description = description;
        this.serviceCode = serviceCode;
        this.uom = uom;
        this.amounts = amounts;
        this.failedField = failedField;
        this.failureReason = failureReason;
    }

    static RowMatch success(String eventCode,
                            String description,
                            String serviceCode,
                            String uom,
                            Map<NumericField, String> amounts) {
        return new RowMatch(eventCode, description, serviceCode, uom,
                Collections.unmodifiableMap(new EnumMap<>(amounts)), null, null);
    }

    static RowMatch failure(RowField field, String reason) {
        return new RowMatch(null, null, null, null, Map.of(), field, reason);
    }

    public boolean isMatch() {
        return failedField == null;
    }

    public String eventCode() {
        return eventCode;
    }

    public String description() {
        return description;
    }

    public String serviceCode() {
        return serviceCode;
    }

    public String uom() {
        return uom;
    }

    /**
     * @param field numeric column
     * @return the raw captured text of that column, or {@code null} when the line did not match
     */
    public String amountText(NumericField field) {
        return amounts.get(field);
    }

    public RowField failedField() {
        return failedField;
    }

    public String failureReason() {
        return failureReason;
    }

    @Override
    public String toString() {
        return isMatch()
                ? "RowMatch[" + eventCode + " | " + description + " | " + serviceCode + " | " + uom + " | " + amounts + "]"
                : "RowMatch[failed at " + failedField + ": " + failureReason + "]";
    }
}
