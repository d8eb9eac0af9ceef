package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.NumericField;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detail row grammar expressed as a tokenizer plus a sequential field consumer:
 * <pre>
 * event_code description service_code uom qty rate charge tax total
 * </pre>
 * The line must be normalized (single spaces, trimmed). The event code is the first token; the seven
 * whitespace-free trailing fields are the last seven tokens; whatever lies between is the description,
 * which must hold at least one token. A line matches only as a whole, so table noise sharing a numeric
 * suffix with real rows is rejected instead of salvaged.
 */
public class RowGrammar {

    /** Trailing fields consumed from the end of the line, last token first. */
    private static final List<RowField> TRAILING_FIELDS = List.of(
            RowField.TOTAL_CHARGE,
            RowField.TAX_AMOUNT,
            RowField.CHARGE,
            RowField.RATE,
            RowField.QUANTITY_AMOUNT,
            RowField.UOM,
            RowField.SERVICE_CODE
    );

    private final ExtractionPatterns patterns;

    public RowGrammar(ExtractionPatterns patterns) {
        this.patterns = patterns;
    }

    /**
     * Runs the grammar over a normalized line.
     *
     * @param normalizedLine output of {@link TextNormalizer#normalize(String)}
     * @return captured fields, or the first field that failed to match
     */
    public RowMatch match(String normalizedLine) {
        if (normalizedLine == null || normalizedLine.isEmpty()) {
            return RowMatch.failure(RowField.EVENT_CODE, "empty line");
        }
        String[] tokens = normalizedLine.split(" ");

        String eventCode = tokens[0];
        if (!patterns.eventCode().matcher(eventCode).matches()) {
            return RowMatch.failure(RowField.EVENT_CODE, "'" + eventCode + "' is not an upper-case alphanumeric code");
        }

        Map<RowField, String> trailing = new EnumMap<>(RowField.class);
        int end = tokens.length;
        for (RowField field : TRAILING_FIELDS) {
            if (end <= 1) {
                return RowMatch.failure(field, "line ends before " + field);
            }
            String token = tokens[end - 1];
            if (!accepts(field, token)) {
                return RowMatch.failure(field, "'" + token + "' does not fit " + field);
            }
            trailing.put(field, token);
            end--;
        }

        if (end <= 1) {
            return RowMatch.failure(RowField.DESCRIPTION, "no description between event code and service code");
        }
        String description = String.join(" ", List.of(tokens).subList(1, end));

        Map<NumericField, String> amounts = new EnumMap<>(NumericField.class);
        trailing.forEach((field, token) -> {
            if (field.isNumeric()) {
                amounts.put(field.numericField(), token);
            }
        });
        return RowMatch.success(
                eventCode,
                description,
                trailing.get(RowField.SERVICE_CODE),
                trailing.get(RowField.UOM),
                amounts
        );
    }

    private boolean accepts(RowField field, String token) {
        Pattern pattern;
        if (field == RowField.SERVICE_CODE) {
            pattern = patterns.serviceCode();
        } else if (field == RowField.UOM) {
            pattern = patterns.unitOfMeasure();
        } else {
            pattern = patterns.number();
        }
        return pattern.matcher(token).matches();
    }
}
