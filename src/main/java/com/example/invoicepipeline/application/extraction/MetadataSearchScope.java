package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;

import java.util.List;

/**
 * One layer of the metadata search. Scopes are evaluated in order, independently for every field;
 * the first scope whose texts yield a value for a field wins that field.
 */
public interface MetadataSearchScope {

    /**
     * @return short label used in log messages
     */
    String name();

    /**
     * @param document converted invoice document
     * @return candidate texts in priority order, empty when the scope does not apply to the document
     */
    List<String> texts(InvoiceDocument document);
}
