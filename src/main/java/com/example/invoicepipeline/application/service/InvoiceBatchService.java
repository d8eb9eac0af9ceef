package com.example.invoicepipeline.application.service;

import com.example.invoicepipeline.config.InvoicePipelineProperties;
import com.example.invoicepipeline.domain.exception.InvoiceExtractionException;
import com.example.invoicepipeline.domain.model.BatchRunSummary;
import com.example.invoicepipeline.domain.model.EnrichedInvoiceRow;
import com.example.invoicepipeline.domain.model.InvoiceExtractionResult;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;
import com.example.invoicepipeline.infrastructure.exception.OutputWriteException;
import com.example.invoicepipeline.infrastructure.storage.JsonFileRowWriter;
import com.example.invoicepipeline.infrastructure.storage.ProcessedInvoiceIndex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Runs every new invoice of the input directory through parsing and writes the enriched rows.
 * <p>
 * Documents are independent: a failure is recorded in the summary under its error code and the run moves on,
 * leaving output already written for other documents untouched. Documents without an invoice number are not
 * persisted since the number is their de-duplication key.
 */
@Service
public class InvoiceBatchService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceBatchService.class);

    private final InvoiceParsingService parsingService;
    private final ProcessedInvoiceIndex processedIndex;
    private final JsonFileRowWriter rowWriter;
    private final InvoicePipelineProperties properties;
    private final Clock clock;

    public InvoiceBatchService(InvoiceParsingService parsingService,
                               ProcessedInvoiceIndex processedIndex,
                               JsonFileRowWriter rowWriter,
                               InvoicePipelineProperties properties,
                               Clock clock) {
        this.parsingService = parsingService;
        this.processedIndex = processedIndex;
        this.rowWriter = rowWriter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Processes the configured input directory.
     *
     * @return per-bucket outcome of the run
     * @throws UncheckedIOException when the input directory cannot be listed
     */
    public BatchRunSummary run() {
        List<Path> candidates = discover();
        log.info("Found {} new invoice files in {}.", candidates.size(), properties.getInputDirectory());

        List<String> succeeded = new ArrayList<>();
        List<String> duplicates = new ArrayList<>();
        List<String> metadataFailed = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();

        for (Path file : candidates) {
            String fileName = file.getFileName().toString();
            try {
                InvoiceExtractionResult result = parsingService.parse(file);
                InvoiceMetadata metadata = result.metadata();
                if (metadata.invoiceNumber() == null) {
                    log.error("No invoice number in {}; not persisted.", fileName);
                    metadataFailed.add(fileName);
                    continue;
                }
                if (processedIndex.containsInvoice(metadata.invoiceNumber())) {
                    log.warn("Skipping duplicate: invoice {} from {} was already processed.", metadata.invoiceNumber(), fileName);
                    duplicates.add(fileName);
                    continue;
                }
                rowWriter.write(fileName, metadata.billingCycleDate(), enrich(result, fileName));
                processedIndex.record(fileName, metadata.invoiceNumber());
                succeeded.add(fileName);
                log.info("Processed {} (invoice {}).", fileName, metadata.invoiceNumber());
            } catch (InvoiceExtractionException e) {
                log.error("Failed to process {} [{}]: {}", fileName, e.errorCode(), e.getMessage());
                failed.put(fileName, e.errorCode());
            } catch (OutputWriteException e) {
                log.error("Failed to write output of {}: {}", fileName, e.getMessage(), e);
                failed.put(fileName, e.getErrorCode());
            }
        }

        BatchRunSummary summary = new BatchRunSummary(candidates.size(), succeeded, duplicates, metadataFailed, failed);
        log.info("Batch finished: {} processed, {} failed, {} without metadata, {} duplicates.",
                succeeded.size(), failed.size(), metadataFailed.size(), duplicates.size());
        return summary;
    }

    /**
     * Stamps every row of one document with the same provenance.
     *
     * @param result   extraction result of the document
     * @param fileName source file name, also used as file identifier
     * @return enriched rows in document order
     */
    List<EnrichedInvoiceRow> enrich(InvoiceExtractionResult result, String fileName) {
        String timestamp = Instant.now(clock).toString();
        return result.rows().stream()
                .map(row -> new EnrichedInvoiceRow(row, fileName, fileName, timestamp))
                .toList();
    }

    private List<Path> discover() {
        Path inputDirectory = properties.getInputDirectory();
        if (!Files.isDirectory(inputDirectory)) {
            log.warn("Input directory {} does not exist; nothing to process.", inputDirectory);
            return List.of();
        }
        Pattern fileNamePattern = Pattern.compile(properties.getFileNamePattern(), Pattern.CASE_INSENSITIVE);
        try (Stream<Path> files = Files.list(inputDirectory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> fileNamePattern.matcher(path.getFileName().toString()).find())
                    .filter(path -> !processedIndex.containsFile(path.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + inputDirectory, e);
        }
    }
}
