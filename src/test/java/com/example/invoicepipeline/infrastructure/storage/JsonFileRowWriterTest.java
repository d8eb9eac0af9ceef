package com.example.invoicepipeline.infrastructure.storage;

import com.example.invoicepipeline.config.InvoicePipelineProperties;
import com.example.invoicepipeline.domain.model.EnrichedInvoiceRow;
import com.example.invoicepipeline.domain.model.LineItemRow;
import com.example.invoicepipeline.infrastructure.exception.OutputWriteException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonFileRowWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InvoicePipelineProperties properties;
    private JsonFileRowWriter writer;

    @BeforeEach
    void setUp() {
        properties = new InvoicePipelineProperties();
        properties.setOutputDirectory(tempDir);
        writer = new JsonFileRowWriter(objectMapper, properties);
    }

    @Test
    void resolvesYearAndMonthPartition() {
        Path target = writer.resolveTarget("MCI_Invoice_42.pdf", LocalDate.of(2023, 7, 9));

        assertThat(target).isEqualTo(tempDir.resolve("invoices/mastercard/year=2023/month=07/MCI_Invoice_42.json"));
    }

    @Test
    void undatedDocumentsGoToTheirOwnPartition() {
        Path target = writer.resolveTarget("scan.v2.pdf", null);

        assertThat(target).isEqualTo(tempDir.resolve("invoices/mastercard")
                .resolve(JsonFileRowWriter.UNDATED_PARTITION).resolve("scan.v2.json"));
    }

    @Test
    void writesPrettyPrintedArray() throws Exception {
        LineItemRow row = new LineItemRow(BigInteger.valueOf(7), "2023-07-09", "USD", "EVT1", "Fee", "SVC", "A", 1, 2, 2, 0, 2, Set.of());
        EnrichedInvoiceRow enriched = new EnrichedInvoiceRow(row, "a.pdf", "a.pdf", "2024-05-01T10:00:00Z");

        Path written = writer.write("a.pdf", LocalDate.of(2023, 7, 9), List.of(enriched, enriched));

        String json = Files.readString(written, StandardCharsets.UTF_8);
        assertThat(json).contains(System.lineSeparator());
        JsonNode array = objectMapper.readTree(json);
        assertThat(array).hasSize(2);
        assertThat(array.get(1).get("rate").asDouble()).isEqualTo(2.0);
        assertThat(array.get(1).get("file_name").asText()).isEqualTo("a.pdf");
    }

    @Test
    void unwritableTargetRaisesOutputWriteException() throws Exception {
        Path blocker = tempDir.resolve("blocked");
        Files.writeString(blocker, "a file where a directory is expected");
        properties.setOutputDirectory(blocker);

        assertThrows(OutputWriteException.class, () -> writer.write("a.pdf", LocalDate.of(2023, 7, 9), List.of()));
    }
}
