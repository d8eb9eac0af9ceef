package com.example.invoicepipeline.interfaces.api;

import java.util.List;

/**
 * API-layer DTO for fuzzy vocabulary lookups.
 */
public record MatchRequest(String query, List<String> candidates) {
}
