package com.example.invoicepipeline.application.extraction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Immutable set of compiled matching rules shared by the extraction components.
 * Built once (see {@link #defaults()}) and injected, so patterns are compiled a single time per process.
 *
 * @param number                 numeric token: optional minus, digits and commas, optional fraction
 * @param eventCode              detail row event code token
 * @param serviceCode            detail row service code token (1 to 4 characters)
 * @param unitOfMeasure          detail row unit of measure token
 * @param labeledInvoiceNumber   "Invoice #|No.|Number:" followed by at least ten digits or hyphens
 * @param looseInvoiceNumber     any run of at least nine digits, spaces or hyphens
 * @param billingCycleDate       "Billing Cycle Date:" followed by month abbreviation, day and year
 * @param currency               "Currency:" followed by a three letter code
 * @param months                 upper-case three letter month abbreviation to month number
 * @param headerSignatureParts   phrases that must all appear in a detail table header banner
 * @param anchorHeading          lower-case text of the paragraph that anchors the metadata search
 */
public record ExtractionPatterns(
        Pattern number,
        Pattern eventCode,
        Pattern serviceCode,
        Pattern unitOfMeasure,
        Pattern labeledInvoiceNumber,
        Pattern looseInvoiceNumber,
        Pattern billingCycleDate,
        Pattern currency,
        Map<String, Integer> months,
        List<String> headerSignatureParts,
        String anchorHeading
) {

    private static final String NUMBER = "-?[\\d,]+(?:\\.\\d+)?";

    public ExtractionPatterns {
        months = Map.copyOf(months);
        headerSignatureParts = List.copyOf(headerSignatureParts);
    }

    /**
     * @return the rule set for the itemized invoice layout this service targets
     */
    public static ExtractionPatterns defaults() {
        Map<String, Integer> months = new LinkedHashMap<>();
        String[] abbreviations = {"JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV", "DEC"};
        for (int i = 0; i < abbreviations.length; i++) {
            months.put(abbreviations[i], i + 1);
        }
        return new ExtractionPatterns(
                Pattern.compile(NUMBER),
                Pattern.compile("[A-Z0-9]+"),
                Pattern.compile("[A-Z0-9]{1,4}"),
                Pattern.compile("[A-Z]"),
                Pattern.compile("(?:Invoice\\s*(?:#|No\\.?|Number)?\\s*:?\\s*)(\\d[\\d\\-]{9,})", Pattern.CASE_INSENSITIVE),
                Pattern.compile("(\\d[\\d\\s\\-]{8,})"),
                Pattern.compile("Billing\\s*Cycle\\s*Date\\s*:\\s*([A-Z]{3})\\s+(\\d{1,2})\\s+(\\d{4})", Pattern.CASE_INSENSITIVE),
                Pattern.compile("Currency\\s*:\\s*([A-Z]{3})", Pattern.CASE_INSENSITIVE),
                months,
                List.of(
                        "Event Service Quantity/ Tax Total",
                        "Code Description Code UOM Amount Rate Charge Amount Charge"
                ),
                "invoice"
        );
    }

    /**
     * @param token single whitespace-free token
     * @return {@code true} when the whole token is a number per {@link #number()}
     */
    public boolean isNumber(String token) {
        return number.matcher(token).matches();
    }
}
