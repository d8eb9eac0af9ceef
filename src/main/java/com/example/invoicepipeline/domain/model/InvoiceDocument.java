package com.example.invoicepipeline.domain.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Textual representation of one invoice as handed over by a document converter.
 * Paragraph order is the reading order of the source document.
 */
public record InvoiceDocument(
        String sourceName,
        List<Paragraph> paragraphs
) {

    public InvoiceDocument {
        paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
    }

    /**
     * Convenience factory used by tests and plain-text callers.
     *
     * @param sourceName logical name of the document
     * @param paragraphs paragraph texts in document order
     * @return document with one single-fragment paragraph per entry
     */
    public static InvoiceDocument ofParagraphs(String sourceName, List<String> paragraphs) {
        return new InvoiceDocument(sourceName, paragraphs.stream().map(Paragraph::of).toList());
    }

    /**
     * @return {@code true} when the converter produced no visible text at all
     */
    public boolean isEmpty() {
        return paragraphs.stream().allMatch(Paragraph::isBlank);
    }

    /**
     * Concatenates the search text of all paragraphs, one per line, in document order.
     *
     * @return whole-document text used by fallback metadata searches
     */
    public String fullText() {
        return paragraphs.stream()
                .map(Paragraph::searchText)
                .collect(Collectors.joining("\n"));
    }
}
