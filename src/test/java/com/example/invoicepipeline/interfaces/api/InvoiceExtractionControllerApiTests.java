package com.example.invoicepipeline.interfaces.api;

import com.example.invoicepipeline.application.exception.RowExportValidationException;
import com.example.invoicepipeline.application.extraction.FuzzySimilarityMatcher;
import com.example.invoicepipeline.application.service.InvoiceBatchService;
import com.example.invoicepipeline.application.service.InvoiceParsingService;
import com.example.invoicepipeline.application.service.RowExportService;
import com.example.invoicepipeline.domain.exception.InvoiceExtractionException;
import com.example.invoicepipeline.domain.model.BatchRunSummary;
import com.example.invoicepipeline.domain.model.FuzzyMatch;
import com.example.invoicepipeline.domain.model.InvoiceExtractionResult;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;
import com.example.invoicepipeline.domain.model.LineItemRow;
import com.example.invoicepipeline.infrastructure.exception.OutputWriteException;
import com.example.invoicepipeline.interfaces.api.error.GlobalExceptionHandler;
import org.junit.jupiter.api.Test;
import org.mockito.BDDMockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * WebMvc tests that validate the controller-to-exception-handler integration.
 */
@WebMvcTest(controllers = InvoiceExtractionController.class)
@Import(GlobalExceptionHandler.class)
class InvoiceExtractionControllerApiTests {

    private static final MockMultipartFile UPLOAD =
            new MockMultipartFile("file", "invoice.pdf", "application/pdf", "data".getBytes());

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InvoiceParsingService parsingService;

    @MockBean
    private RowExportService rowExportService;

    @MockBean
    private InvoiceBatchService batchService;

    @MockBean
    private FuzzySimilarityMatcher matcher;

    /**
     * Verifies the extraction result is serialized with snake_case row fields.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void extractReturnsMetadataAndRows() throws Exception {
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class))).willReturn(sampleResult());

        mockMvc.perform(multipart("/api/extract").file(UPLOAD))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceName").value("invoice.pdf"))
                .andExpect(jsonPath("$.metadata.invoice_number").value(1234567890L))
                .andExpect(jsonPath("$.metadata.billing_cycle_date").value("2024-01-15"))
                .andExpect(jsonPath("$.rows[0].event_code").value("EVT1"))
                .andExpect(jsonPath("$.rows[0].total_charge").value(26.25));
    }

    /**
     * Verifies that missing input translates to HTTP 400 with its error code.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void missingInputMappedToBadRequest() throws Exception {
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class)))
                .willThrow(InvoiceExtractionException.inputMissing("<empty upload>"));

        mockMvc.perform(multipart("/api/extract").file(UPLOAD))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INPUT_MISSING"))
                .andExpect(jsonPath("$.path").value("/api/extract"));
    }

    /**
     * Verifies that conversion and parse failures translate to HTTP 422.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void emptyResultMappedToUnprocessableEntity() throws Exception {
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class)))
                .willThrow(InvoiceExtractionException.emptyResult("invoice.pdf"));

        mockMvc.perform(multipart("/api/extract").file(UPLOAD))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("PARSER_EMPTY_RESULT"));
    }

    @Test
    void conversionFailureMappedToUnprocessableEntity() throws Exception {
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class)))
                .willThrow(InvoiceExtractionException.conversionFailure("invoice.pdf", new IOException("bad xref")));

        mockMvc.perform(multipart("/api/extract").file(UPLOAD))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("CONVERSION_FAILURE"));
    }

    @Test
    void jsonLinesEndpointStreamsNdjson() throws Exception {
        InvoiceExtractionResult result = sampleResult();
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class))).willReturn(result);
        BDDMockito.given(rowExportService.toJsonLines(result.rows())).willReturn("{\"event_code\":\"EVT1\"}\n");

        mockMvc.perform(multipart("/api/extract/rows.jsonl").file(UPLOAD))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/x-ndjson"))
                .andExpect(content().string("{\"event_code\":\"EVT1\"}\n"));
    }

    @Test
    void csvEndpointReturnsAttachment() throws Exception {
        InvoiceExtractionResult result = sampleResult();
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class))).willReturn(result);
        BDDMockito.given(rowExportService.toCsv(result.rows())).willReturn("invoice_number\n1234567890\n");

        mockMvc.perform(multipart("/api/extract/rows.csv").file(UPLOAD))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"invoice-rows.csv\""))
                .andExpect(content().string("invoice_number\n1234567890\n"));
    }

    /**
     * Verifies that export validation errors translate to HTTP 422 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void exportValidationExceptionMappedTo422() throws Exception {
        BDDMockito.given(parsingService.parse(BDDMockito.any(MultipartFile.class))).willReturn(sampleResult());
        BDDMockito.given(rowExportService.toCsv(BDDMockito.any()))
                .willThrow(new RowExportValidationException("No parsed rows available for export."));

        mockMvc.perform(multipart("/api/extract/rows.csv").file(UPLOAD))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("ROW_EXPORT_VALIDATION_ERROR"));
    }

    @Test
    void batchRunReturnsSummary() throws Exception {
        BDDMockito.given(batchService.run()).willReturn(new BatchRunSummary(
                2,
                List.of("MCI_Invoice_1.pdf"),
                List.of(),
                List.of(),
                Map.of("MCI_Invoice_2.pdf", "CONVERSION_FAILURE")
        ));

        mockMvc.perform(post("/api/batch/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.candidates").value(2))
                .andExpect(jsonPath("$.processedSuccessfully[0]").value("MCI_Invoice_1.pdf"))
                .andExpect(jsonPath("$.failed['MCI_Invoice_2.pdf']").value("CONVERSION_FAILURE"));
    }

    /**
     * Verifies that infrastructure errors translate to HTTP 500 responses.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void infrastructureExceptionMappedToServerError() throws Exception {
        BDDMockito.given(batchService.run())
                .willThrow(new OutputWriteException("Unable to write", new IOException("disk full")));

        mockMvc.perform(post("/api/batch/run"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INFRASTRUCTURE_ERROR"));
    }

    @Test
    void matchReturnsBestCandidate() throws Exception {
        BDDMockito.given(matcher.bestMatch("Acme Corporation", List.of("Widgets Inc", "Acme Corp")))
                .willReturn(new FuzzyMatch("Acme Corp", 0.72));

        mockMvc.perform(post("/api/match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"Acme Corporation\",\"candidates\":[\"Widgets Inc\",\"Acme Corp\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.best").value("Acme Corp"))
                .andExpect(jsonPath("$.score").value(0.72));
    }

    /**
     * @return extraction result used across the test cases
     */
    private InvoiceExtractionResult sampleResult() {
        LineItemRow row = new LineItemRow(BigInteger.valueOf(1234567890), "2024-01-15", "USD", "EVT1", "Network Access Fee", "SVC", "A",
                10, 2.5, 25, 1.25, 26.25, Set.of());
        return new InvoiceExtractionResult("invoice.pdf", 3,
                new InvoiceMetadata(BigInteger.valueOf(1234567890), LocalDate.of(2024, 1, 15), "USD"), List.of(row));
    }
}
