package com.example.invoicepipeline.infrastructure.storage;

import com.example.invoicepipeline.config.InvoicePipelineProperties;
import com.example.invoicepipeline.domain.model.EnrichedInvoiceRow;
import com.example.invoicepipeline.infrastructure.exception.OutputWriteException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes the enriched rows of one document as a pretty-printed JSON array, partitioned by billing cycle
 * year and month: {@code <output>/<prefix>/year=YYYY/month=MM/<file stem>.json}.
 */
@Component
public class JsonFileRowWriter {

    private static final Logger log = LoggerFactory.getLogger(JsonFileRowWriter.class);
    static final String UNDATED_PARTITION = "undated";

    private final ObjectMapper objectMapper;
    private final InvoicePipelineProperties properties;

    public JsonFileRowWriter(ObjectMapper objectMapper, InvoicePipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * @param fileName         source file name, its stem names the output file
     * @param billingCycleDate partition date, {@code null} routes the file to the undated partition
     * @param rows             rows to write
     * @return path of the written file
     * @throws OutputWriteException when serialization or the write fails
     */
    public Path write(String fileName, LocalDate billingCycleDate, List<EnrichedInvoiceRow> rows) {
        Path target = resolveTarget(fileName, billingCycleDate);
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
            Files.createDirectories(target.getParent());
            Files.writeString(target, json, StandardCharsets.UTF_8);
            log.info("Wrote {} rows to {}.", rows.size(), target);
            return target;
        } catch (JsonProcessingException e) {
            throw new OutputWriteException("Unable to serialize rows of " + fileName, e);
        } catch (IOException e) {
            throw new OutputWriteException("Unable to write " + target, e);
        }
    }

    /**
     * Builds the partitioned output path for a document.
     *
     * @param fileName         source file name
     * @param billingCycleDate partition date or {@code null}
     * @return absolute or relative target path under the configured output directory
     */
    public Path resolveTarget(String fileName, LocalDate billingCycleDate) {
        Path base = properties.getOutputDirectory().resolve(properties.getOutputPrefix());
        Path partition = billingCycleDate == null
                ? base.resolve(UNDATED_PARTITION)
                : base.resolve("year=" + billingCycleDate.getYear())
                        .resolve(String.format("month=%02d", billingCycleDate.getMonthValue()));
        return partition.resolve(stem(fileName) + ".json");
    }

    private static String stem(String fileName) {
        String name = Path.of(fileName).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
