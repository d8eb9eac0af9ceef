package com.example.invoicepipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Settings of the local batch run, bound from {@code invoice.pipeline.*}.
 */
@ConfigurationProperties(prefix = "invoice.pipeline")
public class InvoicePipelineProperties {

    /** Directory scanned for invoice documents. */
    private Path inputDirectory = Path.of("process_data", "downloads");

    /** Root directory of the JSON output. */
    private Path outputDirectory = Path.of("process_data", "final_jsons");

    /** Relative prefix of the partitioned output below the output directory. */
    private String outputPrefix = "invoices/mastercard";

    /** Case-insensitive pattern a file name must match to be processed. */
    private String fileNamePattern = "^MCI_Invoice_.*\\.pdf$";

    public Path getInputDirectory() {
        return inputDirectory;
    }

    public void setInputDirectory(Path inputDirectory) {
        this.inputDirectory = inputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public void setOutputDirectory(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    public void setOutputPrefix(String outputPrefix) {
        this.outputPrefix = outputPrefix;
    }

    public String getFileNamePattern() {
        return fileNamePattern;
    }

    public void setFileNamePattern(String fileNamePattern) {
        this.fileNamePattern = fileNamePattern;
    }
}
