package com.example.invoicepipeline.interfaces.api;

import com.example.invoicepipeline.application.extraction.FuzzySimilarityMatcher;
import com.example.invoicepipeline.application.service.InvoiceBatchService;
import com.example.invoicepipeline.application.service.InvoiceParsingService;
import com.example.invoicepipeline.application.service.RowExportService;
import com.example.invoicepipeline.domain.model.BatchRunSummary;
import com.example.invoicepipeline.domain.model.FuzzyMatch;
import com.example.invoicepipeline.domain.model.InvoiceExtractionResult;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer REST controller for invoice uploads, row exports, batch runs and vocabulary matching.
 */
@RestController
@RequestMapping("/api")
public class InvoiceExtractionController {

    static final MediaType NDJSON = MediaType.parseMediaType("application/x-ndjson");

    private final InvoiceParsingService parsingService;
    private final RowExportService rowExportService;
    private final InvoiceBatchService batchService;
    private final FuzzySimilarityMatcher matcher;

    /**
     * Creates the controller with the required application services.
     *
     * @param parsingService   service responsible for extracting invoices
     * @param rowExportService service responsible for row serialization
     * @param batchService     service running the local batch
     * @param matcher          fuzzy vocabulary matcher
     */
    public InvoiceExtractionController(InvoiceParsingService parsingService,
                                       RowExportService rowExportService,
                                       InvoiceBatchService batchService,
                                       FuzzySimilarityMatcher matcher) {
        this.parsingService = parsingService;
        this.rowExportService = rowExportService;
        this.batchService = batchService;
        this.matcher = matcher;
    }

    /**
     * Extracts metadata and rows from an uploaded invoice (PDF or XHTML).
     *
     * @param file uploaded document
     * @return JSON response containing the extraction result
     */
    @PostMapping(value = "/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<InvoiceExtractionResult> extract(@RequestParam("file") MultipartFile file) {
        return ResponseEntity.ok(parsingService.parse(file));
    }

    /**
     * Extracts an uploaded invoice and returns its rows as newline-delimited JSON.
     *
     * @param file uploaded document
     * @return one JSON object per row
     */
    @PostMapping("/extract/rows.jsonl")
    public ResponseEntity<String> extractJsonLines(@RequestParam("file") MultipartFile file) {
        InvoiceExtractionResult result = parsingService.parse(file);
        return ResponseEntity.ok()
                .contentType(NDJSON)
                .body(rowExportService.toJsonLines(result.rows()));
    }

    /**
     * Extracts an uploaded invoice and streams its rows as a CSV download.
     *
     * @param file uploaded document
     * @return CSV document
     */
    @PostMapping("/extract/rows.csv")
    public ResponseEntity<byte[]> extractCsv(@RequestParam("file") MultipartFile file) {
        InvoiceExtractionResult result = parsingService.parse(file);
        String csv = rowExportService.toCsv(result.rows());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"invoice-rows.csv\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Processes every new invoice of the configured input directory.
     *
     * @return batch summary
     */
    @PostMapping(value = "/batch/run", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchRunSummary> runBatch() {
        return ResponseEntity.ok(batchService.run());
    }

    /**
     * Finds the closest candidate for a free-text value.
     *
     * @param request query and candidate vocabulary
     * @return best candidate and score
     */
    @PostMapping(value = "/match", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FuzzyMatch> match(@RequestBody MatchRequest request) {
        return ResponseEntity.ok(matcher.bestMatch(request.query(), request.candidates()));
    }
}
