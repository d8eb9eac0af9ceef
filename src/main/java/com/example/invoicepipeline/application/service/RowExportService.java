package com.example.invoicepipeline.application.service;

import com.example.invoicepipeline.application.exception.RowExportValidationException;
import com.example.invoicepipeline.domain.model.LineItemRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.List;

/**
 * Application-layer service that turns extracted rows into row-oriented downloads.
 */
@Service
public class RowExportService {

    private static final String CSV_HEADER = "invoice_number,billing_cycle_date,currency,event_code,description,"
            + "service_code,uom,quantity_amount,rate,charge,tax_amount,total_charge\n";

    private final ObjectMapper objectMapper;

    public RowExportService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

	/**
	 * Serializes every row as one JSON object per line.
	 *
	 * @param rows rows to export, {@link LineItemRow} or enriched rows
	 * @return newline-delimited JSON, terminated by a newline
	 * @throws RowExportValidationException when there is nothing to export
	 */
    public String toJsonLines(List<?> rows) {
        requireRows(rows);
        StringBuilder builder = new StringBuilder();
        for (Object row : rows) {
            try {
                builder.append(objectMapper.writeValueAsString(row)).append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Unable to serialize row " + row, e);
            }
        }
        return builder.toString();
    }

	/**
	 * Builds a CSV document including the header row and escaped values.
	 *
	 * @param rows rows to export
	 * @return CSV document as a string
	 * @throws RowExportValidationException when there is nothing to export
	 */
    public String toCsv(List<LineItemRow> rows) {
        requireRows(rows);
        StringBuilder builder = new StringBuilder(CSV_HEADER);
        for (LineItemRow row : rows) {
            builder.append(row.invoiceNumber() == null ? "" : row.invoiceNumber()).append(',')
                    .append(escape(row.billingCycleDate())).append(',')
                    .append(escape(row.currency())).append(',')
                    .append(escape(row.eventCode())).append(',')
                    .append(escape(row.description())).append(',')
                    .append(escape(row.serviceCode())).append(',')
                    .append(escape(row.uom())).append(',')
                    .append(amount(row.quantityAmount())).append(',')
                    .append(amount(row.rate())).append(',')
                    .append(amount(row.charge())).append(',')
                    .append(amount(row.taxAmount())).append(',')
                    .append(amount(row.totalCharge()))
                    .append('\n');
        }
        return builder.toString();
    }

    private void requireRows(List<?> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new RowExportValidationException("No parsed rows available for export.");
        }
    }

    private String amount(double value) {
        return String.valueOf(value);
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
