package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * Recovers invoice number, billing cycle date and currency from a converted document.
 * <p>
 * Each field is resolved on its own by walking the ordered {@link MetadataSearchScope} list (anchored search
 * next to the "Invoice" heading, then the whole document); a scope resolving one field never prevents a later
 * scope from resolving another. Unresolved fields stay {@code null} and are logged, never raised.
 */
@Component
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private final ExtractionPatterns patterns;
    private final List<MetadataSearchScope> scopes;

    /**
     * Creates the extractor with the default anchored-then-document search order.
     *
     * @param patterns compiled rule set
     */
    @Autowired
    public MetadataExtractor(ExtractionPatterns patterns) {
        this(patterns, List.of(new AnchoredParagraphScope(patterns), new WholeDocumentScope()));
    }

    /**
     * @param patterns compiled rule set
     * @param scopes   search layers in priority order
     */
    public MetadataExtractor(ExtractionPatterns patterns, List<MetadataSearchScope> scopes) {
        this.patterns = patterns;
        this.scopes = List.copyOf(scopes);
    }

    /**
     * Extracts whatever metadata the document provides.
     *
     * @param document converted invoice document
     * @return metadata with absent fields left {@code null}
     */
    public InvoiceMetadata extract(InvoiceDocument document) {
        BigInteger invoiceNumber = resolve(document, "invoice number", this::findInvoiceNumber);
        LocalDate billingCycleDate = resolve(document, "billing cycle date", this::findBillingCycleDate);
        String currency = resolve(document, "currency", this::findCurrency);

        if (invoiceNumber == null) {
            log.warn("No 'Invoice # <number>' found in {}.", document.sourceName());
        }
        if (billingCycleDate == null) {
            log.warn("No 'Billing Cycle Date: <MON DD YYYY>' found in {}.", document.sourceName());
        }
        if (currency == null) {
            log.warn("No 'Currency: <CCC>' found in {}.", document.sourceName());
        }
        return new InvoiceMetadata(invoiceNumber, billingCycleDate, currency);
    }

    private <T> T resolve(InvoiceDocument document, String fieldName, Function<String, Optional<T>> finder) {
        for (MetadataSearchScope scope : scopes) {
            for (String text : scope.texts(document)) {
                Optional<T> value = finder.apply(TextNormalizer.normalize(text));
                if (value.isPresent()) {
                    log.debug("Resolved {} via {} search: {}", fieldName, scope.name(), value.get());
                    return value.get();
                }
            }
        }
        return null;
    }

    /**
     * Prefers the labeled invoice number and falls back to any long digit run of the same text.
     *
     * @param text normalized text to search
     * @return digits of the first candidate as a number of any length
     */
    Optional<BigInteger> findInvoiceNumber(String text) {
        Matcher labeled = patterns.labeledInvoiceNumber().matcher(text);
        if (labeled.find()) {
            return toInvoiceNumber(labeled.group(1));
        }
        Matcher loose = patterns.looseInvoiceNumber().matcher(text);
        if (loose.find()) {
            return toInvoiceNumber(loose.group(1));
        }
        return Optional.empty();
    }

    /**
     * Reads the billing cycle date. An unknown month or an impossible calendar date yields empty.
     *
     * @param text normalized text to search
     * @return resolved date
     */
    Optional<LocalDate> findBillingCycleDate(String text) {
        Matcher matcher = patterns.billingCycleDate().matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        Integer month = patterns.months().get(matcher.group(1).toUpperCase(Locale.ROOT));
        if (month == null) {
            return Optional.empty();
        }
        int day = Integer.parseInt(matcher.group(2));
        int year = Integer.parseInt(matcher.group(3));
        if (year < 1) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            log.debug("Ignoring invalid billing cycle date '{}': {}", matcher.group(), e.getMessage());
            return Optional.empty();
        }
    }

    Optional<String> findCurrency(String text) {
        Matcher matcher = patterns.currency().matcher(text);
        return matcher.find()
                ? Optional.of(matcher.group(1).toUpperCase(Locale.ROOT))
                : Optional.empty();
    }

    // both invoice number patterns start with a digit, so the digit string is never empty
    private Optional<BigInteger> toInvoiceNumber(String candidate) {
        return Optional.of(new BigInteger(candidate.replaceAll("\\D", "")));
    }
}
