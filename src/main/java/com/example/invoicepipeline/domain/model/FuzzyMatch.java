package com.example.invoicepipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Best candidate found by the fuzzy matcher and its similarity score in {@code [0, 1]}.
 * {@code best} is {@code null} when no candidate scored above zero.
 */
public record FuzzyMatch(String best, double score) {

    public static FuzzyMatch none() {
        return new FuzzyMatch(null, 0.0);
    }

    @JsonIgnore
    public boolean isPresent() {
        return best != null;
    }
}
