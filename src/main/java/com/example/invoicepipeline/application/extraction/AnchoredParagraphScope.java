package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.Paragraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Searches next to the heading paragraph whose whole text reads "invoice": first that paragraph,
 * then the paragraph right after it.
 */
public class AnchoredParagraphScope implements MetadataSearchScope {

    private final String anchorHeading;

    public AnchoredParagraphScope(ExtractionPatterns patterns) {
        this.anchorHeading = patterns.anchorHeading();
    }

    @Override
    public String name() {
        return "anchored";
    }

    @Override
    public List<String> texts(InvoiceDocument document) {
        List<Paragraph> paragraphs = document.paragraphs();
        for (int i = 0; i < paragraphs.size(); i++) {
            String heading = TextNormalizer.normalize(paragraphs.get(i).text()).toLowerCase(Locale.ROOT);
            if (heading.equals(anchorHeading)) {
                List<String> texts = new ArrayList<>(2);
                texts.add(paragraphs.get(i).searchText());
                if (i + 1 < paragraphs.size()) {
                    texts.add(paragraphs.get(i + 1).searchText());
                }
                return texts;
            }
        }
        return List.of();
    }
}
