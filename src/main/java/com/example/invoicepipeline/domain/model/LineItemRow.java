package com.example.invoicepipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.Set;

/**
 * Domain DTO describing one detail row of the itemized invoice table.
 * Each row carries a denormalized copy of the document metadata so it can be persisted on its own.
 * <p>
 * {@code degradedFields} lists the numeric columns whose text could not be parsed and were set to {@code 0.0};
 * it is never serialized so the external row shape stays unchanged.
 */
@JsonPropertyOrder({
        "invoice_number", "billing_cycle_date", "currency",
        "event_code", "description", "service_code", "uom",
        "quantity_amount", "rate", "charge", "tax_amount", "total_charge"
})
public record LineItemRow(
        @JsonProperty("invoice_number") BigInteger invoiceNumber,
        @JsonProperty("billing_cycle_date") String billingCycleDate,
        @JsonProperty("currency") String currency,
        @JsonProperty("event_code") String eventCode,
        @JsonProperty("description") String description,
        @JsonProperty("service_code") String serviceCode,
        @JsonProperty("uom") String uom,
        @JsonProperty("quantity_amount") double quantityAmount,
        @JsonProperty("rate") double rate,
        @JsonProperty("charge") double charge,
        @JsonProperty("tax_amount") double taxAmount,
        @JsonProperty("total_charge") double totalCharge,
        @JsonIgnore Set<NumericField> degradedFields
) {

    public LineItemRow {
        degradedFields = degradedFields == null || degradedFields.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(degradedFields));
    }

    /**
     * @param field numeric column to inspect
     * @return {@code true} when the column holds {@code 0.0} because its text failed to parse
     */
    public boolean isDegraded(NumericField field) {
        return degradedFields.contains(field);
    }
}
