package com.example.invoicepipeline.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one local batch run, bucketed the way operators triage documents.
 *
 * @param candidates                files matching the invoice file name pattern and not yet processed
 * @param processedSuccessfully     file names whose rows were written
 * @param skippedDuplicates         file names whose invoice number was already processed
 * @param metadataExtractionFailed  file names without a resolvable invoice number
 * @param failed                    file name to error code for every failed document
 */
public record BatchRunSummary(
        int candidates,
        List<String> processedSuccessfully,
        List<String> skippedDuplicates,
        List<String> metadataExtractionFailed,
        Map<String, String> failed
) {

    public BatchRunSummary {
        processedSuccessfully = List.copyOf(processedSuccessfully);
        skippedDuplicates = List.copyOf(skippedDuplicates);
        metadataExtractionFailed = List.copyOf(metadataExtractionFailed);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }
}
