package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;

import java.util.List;

/**
 * Fallback layer: the concatenation of every paragraph in document order.
 */
public class WholeDocumentScope implements MetadataSearchScope {

    @Override
    public String name() {
        return "document";
    }

    @Override
    public List<String> texts(InvoiceDocument document) {
        return List.of(document.fullText());
    }
}
