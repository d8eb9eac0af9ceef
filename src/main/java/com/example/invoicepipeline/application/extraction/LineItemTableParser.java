package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;
import com.example.invoicepipeline.domain.model.LineClassification;
import com.example.invoicepipeline.domain.model.LineItemRow;
import com.example.invoicepipeline.domain.model.NumericField;
import com.example.invoicepipeline.domain.model.Paragraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds the itemized detail table from paragraph text.
 * <p>
 * This is a line classifier rather than a layout parser: every converted table row is expected on a single line
 * of a paragraph. Lines are classified as header banner, subtotal, detail row or noise; only detail rows are
 * emitted, in document order, each stamped with the metadata resolved once for the whole document.
 */
@Component
public class LineItemTableParser {

    private static final Logger log = LoggerFactory.getLogger(LineItemTableParser.class);
    private static final int MIN_ROW_TOKENS = 9;

    private final ExtractionPatterns patterns;
    private final MetadataExtractor metadataExtractor;
    private final RowGrammar rowGrammar;

    public LineItemTableParser(ExtractionPatterns patterns, MetadataExtractor metadataExtractor) {
        this.patterns = patterns;
        this.metadataExtractor = metadataExtractor;
        this.rowGrammar = new RowGrammar(patterns);
    }

    /**
     * Extracts the document metadata and then every detail row.
     *
     * @param document converted invoice document
     * @return rows in document order, possibly empty
     */
    public List<LineItemRow> parse(InvoiceDocument document) {
        return parse(document, metadataExtractor.extract(document));
    }

    /**
     * Extracts every detail row, stamping each with already resolved metadata.
     *
     * @param document converted invoice document
     * @param metadata metadata of that document
     * @return rows in document order, possibly empty
     */
    public List<LineItemRow> parse(InvoiceDocument document, InvoiceMetadata metadata) {
        InvoiceMetadata resolved = metadata == null ? InvoiceMetadata.empty() : metadata;
        List<LineItemRow> rows = new ArrayList<>();
        int headers = 0;
        int subtotals = 0;
        for (Paragraph paragraph : document.paragraphs()) {
            for (String rawLine : paragraph.lines()) {
                String line = TextNormalizer.normalize(rawLine);
                if (line.isEmpty()) {
                    continue;
                }
                if (isHeaderBanner(line)) {
                    headers++;
                    continue;
                }
                if (isSubtotalLine(line)) {
                    subtotals++;
                    continue;
                }
                RowMatch match = rowGrammar.match(line);
                if (match.isMatch()) {
                    rows.add(toRow(match, resolved));
                } else if (line.split(" ").length >= MIN_ROW_TOKENS) {
                    log.debug("Line rejected at {} ({}): {}", match.failedField(), match.failureReason(), line);
                }
            }
        }
        log.debug("Parsed {} detail rows from {} (skipped {} header banners, {} subtotal lines).",
                rows.size(), document.sourceName(), headers, subtotals);
        return rows;
    }

    /**
     * Classifies a single raw line of the detail table.
     *
     * @param rawLine line text, normalized internally
     * @return classification of the line
     */
    public LineClassification classify(String rawLine) {
        String line = TextNormalizer.normalize(rawLine);
        if (line.isEmpty()) {
            return LineClassification.NOISE;
        }
        if (isHeaderBanner(line)) {
            return LineClassification.HEADER_BANNER;
        }
        if (isSubtotalLine(line)) {
            return LineClassification.SUBTOTAL;
        }
        return rowGrammar.match(line).isMatch() ? LineClassification.DETAIL_ROW : LineClassification.NOISE;
    }

    /**
     * Runs the row grammar alone and reports which field stopped the match, for triaging unusual layouts.
     *
     * @param rawLine line text, normalized internally
     * @return grammar outcome
     */
    public RowMatch diagnose(String rawLine) {
        return rowGrammar.match(TextNormalizer.normalize(rawLine));
    }

    /**
     * @param line normalized line
     * @return {@code true} when the line is one numeric token
     */
    boolean isSubtotalLine(String line) {
        return patterns.isNumber(line.strip());
    }

    /**
     * @param line normalized line
     * @return {@code true} when every header signature phrase appears in the line
     */
    boolean isHeaderBanner(String line) {
        String normalized = TextNormalizer.normalize(line);
        return patterns.headerSignatureParts().stream().allMatch(normalized::contains);
    }

    private LineItemRow toRow(RowMatch match, InvoiceMetadata metadata) {
        Map<NumericField, Double> values = new EnumMap<>(NumericField.class);
        Set<NumericField> degraded = EnumSet.noneOf(NumericField.class);
        for (NumericField field : NumericField.values()) {
            String text = match.amountText(field);
            Double value = parseAmount(text);
            if (value == null) {
                log.warn("Unparsable {} '{}' for event {}; using 0.0.", field, text, match.eventCode());
                degraded.add(field);
                value = 0.0;
            }
            values.put(field, value);
        }
        return new LineItemRow(
                metadata.invoiceNumber(),
                metadata.billingCycleDateIso(),
                metadata.currency(),
                match.eventCode(),
                match.description(),
                match.serviceCode(),
                match.uom(),
                values.get(NumericField.QUANTITY_AMOUNT),
                values.get(NumericField.RATE),
                values.get(NumericField.CHARGE),
                values.get(NumericField.TAX_AMOUNT),
                values.get(NumericField.TOTAL_CHARGE),
                degraded
        );
    }

    /**
     * Strips thousands separators and parses the amount.
     *
     * @param text numeric capture such as {@code -1,234.50}
     * @return parsed value or {@code null} when the text is not a number
     */
    static Double parseAmount(String text) {
        if (text == null) {
            return null;
        }
        try {
            return Double.parseDouble(text.replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
