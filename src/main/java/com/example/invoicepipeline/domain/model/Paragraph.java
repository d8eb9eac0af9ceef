package com.example.invoicepipeline.domain.model;

import java.util.Arrays;
import java.util.List;

/**
 * One paragraph-like block of a converted invoice document.
 * Fragments are the raw text pieces of the block in reading order (text nodes of a {@code <p>} element,
 * or the whole block when the converter produces plain text). Line breaks inside fragments are preserved.
 */
public record Paragraph(List<String> fragments) {

    public Paragraph {
        fragments = fragments == null ? List.of() : List.copyOf(fragments);
    }

    /**
     * Creates a paragraph from a single text block.
     *
     * @param text paragraph text, possibly spanning several lines
     * @return paragraph holding one fragment
     */
    public static Paragraph of(String text) {
        return new Paragraph(text == null ? List.of() : List.of(text));
    }

    /**
     * @return fragments concatenated without separator
     */
    public String text() {
        return String.join("", fragments);
    }

    /**
     * @return fragments joined by a single space, used for metadata pattern searches
     */
    public String searchText() {
        return String.join(" ", fragments);
    }

    /**
     * Splits the paragraph into its physical lines. Each fragment boundary also counts as a line break.
     *
     * @return lines in document order, unnormalized
     */
    public List<String> lines() {
        return Arrays.asList(String.join("\n", fragments).split("\n", -1));
    }

    public boolean isBlank() {
        return fragments.stream().allMatch(String::isBlank);
    }
}
