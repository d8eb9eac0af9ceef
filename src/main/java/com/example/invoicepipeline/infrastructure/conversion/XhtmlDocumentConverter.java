package com.example.invoicepipeline.infrastructure.conversion;

import com.example.invoicepipeline.domain.exception.InvoiceExtractionException;
import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.Paragraph;

import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.html.HtmlParser;
import org.apache.tika.sax.ToXMLContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads HTML and XHTML invoices, including the rendering produced by an external conversion service
 * (one {@code <p>} per text block).
 * <p>
 * The markup is first run through Tika's lenient HTML parser and re-serialized as well-formed XHTML, so
 * doctype declarations, named entities such as {@code &nbsp;}, void elements such as {@code <br>} and
 * unclosed tags are accepted. Each {@code <p>} element of that XHTML becomes one {@link Paragraph} whose
 * fragments are the element's text nodes; {@code <br>} arrives as a line break inside the text.
 */
@Component
@Order(2)
public class XhtmlDocumentConverter implements DocumentConverter {

    private static final Logger log = LoggerFactory.getLogger(XhtmlDocumentConverter.class);

    private static final String DEFAULT_CONTENT_TYPE = "text/html; charset=UTF-8";

    @Override
    public boolean supports(String fileName, String contentType) {
        if (contentType != null) {
            String type = contentType.toLowerCase(Locale.ROOT);
            if (type.contains("xhtml") || type.startsWith("text/html") || type.endsWith("/xml")) {
                return true;
            }
        }
        if (fileName == null) {
            return false;
        }
        String name = fileName.toLowerCase(Locale.ROOT);
        return name.endsWith(".html") || name.endsWith(".xhtml") || name.endsWith(".htm") || name.endsWith(".xml");
    }

    @Override
    public InvoiceDocument convert(byte[] content, String sourceName) {
        try {
            Document dom = parse(toXhtml(content, sourceName));
            NodeList elements = dom.getElementsByTagNameNS("*", "p");
            List<Paragraph> paragraphs = new ArrayList<>(elements.getLength());
            for (int i = 0; i < elements.getLength(); i++) {
                List<String> fragments = new ArrayList<>();
                collectText(elements.item(i), fragments);
                paragraphs.add(new Paragraph(fragments));
            }
            log.info("Read {} paragraphs from {}.", paragraphs.size(), sourceName);
            return new InvoiceDocument(sourceName, paragraphs);
        } catch (TikaException | ParserConfigurationException | SAXException | IOException e) {
            throw InvoiceExtractionException.conversionFailure(sourceName, e);
        }
    }

    private byte[] toXhtml(byte[] content, String sourceName) throws TikaException, SAXException, IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
        Metadata metadata = new Metadata();
        // charset hint for markup without a <meta charset>
        metadata.set(Metadata.CONTENT_TYPE, DEFAULT_CONTENT_TYPE);
        if (sourceName != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, sourceName);
        }
        try (InputStream in = new ByteArrayInputStream(content)) {
            new HtmlParser().parse(in, handler, metadata, new ParseContext());
        }
        return out.toByteArray();
    }

    private Document parse(byte[] content) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setNamespaceAware(true);
        Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(content));
        dom.getDocumentElement().normalize();
        return dom;
    }

    private void collectText(Node node, List<String> fragments) {
        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                String value = child.getNodeValue();
                if (value != null && !value.isEmpty()) {
                    fragments.add(value);
                }
            } else if (child instanceof Element) {
                collectText(child, fragments);
            }
        }
    }
}
