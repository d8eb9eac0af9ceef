package com.example.invoicepipeline.infrastructure.conversion;

import com.example.invoicepipeline.domain.exception.InvoiceExtractionException;
import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.Paragraph;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Converts PDF invoices with PDFBox. The stripper emits a paragraph marker wherever PDFBox detects a paragraph
 * boundary, so every detected paragraph becomes one {@link Paragraph} that keeps its line breaks.
 */
@Component
@Order(1)
public class PdfBoxDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentConverter.class);
    private static final String PARAGRAPH_MARKER = "\u2029";

    @Override
    public boolean supports(String fileName, String contentType) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("pdf")) {
            return true;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    /**
     * Loads the PDF and splits its text into paragraphs.
     *
     * @param content    PDF bytes
     * @param sourceName logical name of the document
     * @return converted document
     * @throws InvoiceExtractionException with {@code CONVERSION_FAILURE} when PDFBox cannot read the bytes
     */
    @Override
    public InvoiceDocument convert(byte[] content, String sourceName) {
        try (PDDocument document = Loader.loadPDF(content)) {
            String text = createStripper().getText(document);
            List<Paragraph> paragraphs = toParagraphs(text);
            log.info("Converted {} ({} pages) into {} paragraphs.", sourceName, document.getNumberOfPages(), paragraphs.size());
            return new InvoiceDocument(sourceName, paragraphs);
        } catch (IOException e) {
            throw InvoiceExtractionException.conversionFailure(sourceName, e);
        }
    }

    /**
     * Applies the stripper configuration: position-sorted text, newline line separators, paragraph markers.
     *
     * @return configured stripper
     * @throws IOException when PDFBox cannot create the stripper
     */
    private PDFTextStripper createStripper() throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(false);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
        stripper.setParagraphStart("");
        stripper.setParagraphEnd(PARAGRAPH_MARKER);
        stripper.setPageEnd(PARAGRAPH_MARKER);
        return stripper;
    }

    private List<Paragraph> toParagraphs(String text) {
        List<Paragraph> paragraphs = new ArrayList<>();
        for (String block : text.split(PARAGRAPH_MARKER)) {
            String trimmed = block.strip();
            if (!trimmed.isEmpty()) {
                paragraphs.add(Paragraph.of(trimmed));
            }
        }
        return paragraphs;
    }
}
