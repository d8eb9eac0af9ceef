package com.example.invoicepipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Invoice-level metadata recovered from the document heading.
 * Every field is independently nullable; {@code null} means "not found" and callers must check it
 * before using the metadata for deduplication or partitioning.
 */
public record InvoiceMetadata(
        @JsonProperty("invoice_number") BigInteger invoiceNumber,
        @JsonProperty("billing_cycle_date") LocalDate billingCycleDate,
        @JsonProperty("currency") String currency
) {

    public static InvoiceMetadata empty() {
        return new InvoiceMetadata(null, null, null);
    }

    /**
     * @return billing cycle date as an ISO-8601 string, or {@code null} when absent
     */
    @JsonIgnore
    public String billingCycleDateIso() {
        return billingCycleDate == null ? null : billingCycleDate.toString();
    }

    @JsonIgnore
    public boolean isComplete() {
        return invoiceNumber != null && billingCycleDate != null && currency != null;
    }

    /**
     * @return names of the fields that could not be resolved, in declaration order
     */
    @JsonIgnore
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (invoiceNumber == null) {
            missing.add("invoice_number");
        }
        if (billingCycleDate == null) {
            missing.add("billing_cycle_date");
        }
        if (currency == null) {
            missing.add("currency");
        }
        return missing;
    }
}
