package com.example.invoicepipeline.application.service;

import com.example.invoicepipeline.application.extraction.LineItemTableParser;
import com.example.invoicepipeline.application.extraction.MetadataExtractor;
import com.example.invoicepipeline.domain.exception.ExtractionErrorCode;
import com.example.invoicepipeline.domain.exception.InvoiceExtractionException;
import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.InvoiceExtractionResult;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;
import com.example.invoicepipeline.domain.model.LineItemRow;
import com.example.invoicepipeline.infrastructure.conversion.DocumentConverter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Application-layer service that runs one invoice through conversion, metadata extraction and row parsing.
 * It validates inputs, delegates conversion to the matching {@link DocumentConverter}, and raises a typed
 * {@link InvoiceExtractionException} for every per-document failure. Missing metadata is not a failure.
 */
@Service
public class InvoiceParsingService {

    private static final Logger log = LoggerFactory.getLogger(InvoiceParsingService.class);

    private final List<DocumentConverter> converters;
    private final MetadataExtractor metadataExtractor;
    private final LineItemTableParser tableParser;

    /**
     * Creates the service with its collaborators.
     *
     * @param converters        available converters, asked in order
     * @param metadataExtractor invoice metadata extractor
     * @param tableParser       detail table parser
     */
    public InvoiceParsingService(List<DocumentConverter> converters,
                                 MetadataExtractor metadataExtractor,
                                 LineItemTableParser tableParser) {
        this.converters = List.copyOf(converters);
        this.metadataExtractor = metadataExtractor;
        this.tableParser = tableParser;
    }

    /**
     * Reads an invoice from the filesystem and extracts it.
     *
     * @param documentPath path of the invoice document
     * @return extraction result
     * @throws InvoiceExtractionException {@code INPUT_MISSING} when the path is null, missing or unreadable,
     *                                    or any conversion/parse code raised downstream
     */
    public InvoiceExtractionResult parse(Path documentPath) {
        if (documentPath == null) {
            throw InvoiceExtractionException.inputMissing("<no path>");
        }
        if (!Files.isRegularFile(documentPath) || !Files.isReadable(documentPath)) {
            throw InvoiceExtractionException.inputMissing(documentPath.toAbsolutePath().toString());
        }
        byte[] content;
        try {
            content = Files.readAllBytes(documentPath);
        } catch (IOException e) {
            throw new InvoiceExtractionException(
                    ExtractionErrorCode.INPUT_MISSING,
                    "Unable to read " + documentPath, e);
        }
        String fileName = documentPath.getFileName() != null ? documentPath.getFileName().toString() : documentPath.toString();
        log.info("Parsing invoice file {}.", documentPath);
        return parse(content, fileName, null);
    }

    /**
     * Extracts an uploaded invoice.
     *
     * @param file uploaded document
     * @return extraction result
     * @throws InvoiceExtractionException {@code INPUT_MISSING} when the upload is absent or empty
     */
    public InvoiceExtractionResult parse(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw InvoiceExtractionException.inputMissing("<empty upload>");
        }
        String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        try {
            return parse(file.getBytes(), fileName, file.getContentType());
        } catch (IOException e) {
            throw new InvoiceExtractionException(
                    ExtractionErrorCode.INPUT_MISSING,
                    "Unable to read uploaded file " + fileName, e);
        }
    }

    /**
     * Shared implementation regardless of the request source.
     *
     * @param content     document bytes
     * @param fileName    logical name
     * @param contentType declared MIME type, may be {@code null}
     * @return extraction result
     */
    InvoiceExtractionResult parse(byte[] content, String fileName, String contentType) {
        DocumentConverter converter = converters.stream()
                .filter(candidate -> candidate.supports(fileName, contentType))
                .findFirst()
                .orElseThrow(() -> InvoiceExtractionException.unsupportedFormat(fileName));
        InvoiceDocument document;
        try {
            document = converter.convert(content, fileName);
        } catch (InvoiceExtractionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw InvoiceExtractionException.conversionFailure(fileName, e);
        }
        return parse(document);
    }

    /**
     * Extracts metadata and rows from an already converted document.
     *
     * @param document converted document
     * @return extraction result with at least one row
     * @throws InvoiceExtractionException {@code CONVERSION_EMPTY_CONTENT} for a document without text,
     *                                    {@code PARSER_EMPTY_RESULT} when no line matched the row grammar
     */
    public InvoiceExtractionResult parse(InvoiceDocument document) {
        if (document == null || document.isEmpty()) {
            throw InvoiceExtractionException.emptyContent(document == null ? "<no document>" : document.sourceName());
        }
        InvoiceMetadata metadata = metadataExtractor.extract(document);
        List<LineItemRow> rows = tableParser.parse(document, metadata);
        if (rows.isEmpty()) {
            throw InvoiceExtractionException.emptyResult(document.sourceName());
        }
        log.info("Parsing of {} completed: {} rows, invoice {}.", document.sourceName(), rows.size(), metadata.invoiceNumber());
        return new InvoiceExtractionResult(document.sourceName(), document.paragraphs().size(), metadata, rows);
    }
}
