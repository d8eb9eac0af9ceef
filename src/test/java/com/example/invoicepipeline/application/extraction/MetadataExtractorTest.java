package com.example.invoicepipeline.application.extraction;

import com.example.invoicepipeline.domain.model.InvoiceDocument;
import com.example.invoicepipeline.domain.model.InvoiceMetadata;
import com.example.invoicepipeline.domain.model.Paragraph;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataExtractorTest {

    private final MetadataExtractor extractor = new MetadataExtractor(ExtractionPatterns.defaults());

    @Test
    void readsAllFieldsFromParagraphAfterInvoiceHeading() {
        InvoiceDocument document = document(
                "ACME Telecom",
                "Invoice",
                "Invoice # 1234567890 Billing Cycle Date: JAN 15 2024 Currency: USD"
        );

        InvoiceMetadata metadata = extractor.extract(document);

        assertThat(metadata.invoiceNumber()).isEqualTo(BigInteger.valueOf(1234567890));
        assertThat(metadata.billingCycleDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        assertThat(metadata.currency()).isEqualTo("USD");
        assertThat(metadata.isComplete()).isTrue();
    }

    @Test
    void invalidCalendarDateResolvesToAbsent() {
        InvoiceDocument document = document("Invoice", "Invoice # 1234567890 Billing Cycle Date: FEB 30 2024 Currency: USD");

        InvoiceMetadata metadata = extractor.extract(document);

        assertThat(metadata.billingCycleDate()).isNull();
        assertThat(metadata.invoiceNumber()).isEqualTo(BigInteger.valueOf(1234567890));
        assertThat(metadata.missingFields()).containsExactly("billing_cycle_date");
    }

    @Test
    void unknownMonthAbbreviationResolvesToAbsent() {
        InvoiceDocument document = document("Billing Cycle Date: XYZ 15 2024");

        assertThat(extractor.extract(document).billingCycleDate()).isNull();
    }

    @Test
    void fallsBackToWholeDocumentWithoutHeading() {
        InvoiceDocument document = document(
                "Statement of charges",
                "Invoice Number: 9876-543-210",
                "billing cycle date : mar 3 2023",
                "currency: eur"
        );

        InvoiceMetadata metadata = extractor.extract(document);

        assertThat(metadata.invoiceNumber()).isEqualTo(BigInteger.valueOf(9876543210L));
        assertThat(metadata.billingCycleDate()).isEqualTo(LocalDate.of(2023, 3, 3));
        assertThat(metadata.currency()).isEqualTo("EUR");
    }

    @Test
    void resolvesEachFieldIndependently() {
        InvoiceDocument document = document(
                "Invoice",
                "Billing Cycle Date: DEC 31 2023",
                "Remit to account 55",
                "Invoice # 1112223334",
                "Currency: CAD"
        );

        InvoiceMetadata metadata = extractor.extract(document);

        assertThat(metadata.billingCycleDate()).isEqualTo(LocalDate.of(2023, 12, 31));
        assertThat(metadata.invoiceNumber()).isEqualTo(BigInteger.valueOf(1112223334));
        assertThat(metadata.currency()).isEqualTo("CAD");
    }

    @Test
    void anchoredSearchWinsOverEarlierMatchesInTheDocument() {
        InvoiceDocument document = document(
                "Previous balance Currency: EUR",
                "Invoice",
                "Currency: USD"
        );

        assertThat(extractor.extract(document).currency()).isEqualTo("USD");
    }

    @Test
    void fallsBackToUnlabeledDigitRun() {
        InvoiceDocument document = document("Reference 123 456 7890");

        assertThat(extractor.extract(document).invoiceNumber()).isEqualTo(BigInteger.valueOf(1234567890));
    }

    @Test
    void labeledNumberNeedsAtLeastTenDigits() {
        assertThat(extractor.findInvoiceNumber("Invoice # 12345")).isEmpty();
        assertThat(extractor.findInvoiceNumber("Invoice No. 1234567890")).contains(BigInteger.valueOf(1234567890));
        assertThat(extractor.findInvoiceNumber("INVOICE:1234-5678-90")).contains(BigInteger.valueOf(1234567890));
    }

    @Test
    void invoiceNumbersWiderThanALongAreKept() {
        InvoiceDocument document = document("Invoice", "Invoice # 1234-5678-9012-3456-7890 Currency: USD");

        InvoiceMetadata metadata = extractor.extract(document);

        assertThat(metadata.invoiceNumber()).isEqualTo(new BigInteger("12345678901234567890"));
        assertThat(metadata.currency()).isEqualTo("USD");
    }

    @Test
    void headingMatchIgnoresCaseAndNonBreakingSpaces() {
        InvoiceDocument document = new InvoiceDocument("nbsp.html", List.of(
                new Paragraph(List.of("\u00A0", "INVOICE", "\u00A0 ")),
                new Paragraph(List.of("Currency:\u00A0gbp"))
        ));

        assertThat(extractor.extract(document).currency()).isEqualTo("GBP");
    }

    @Test
    void missingFieldsAreReportedNotRaised() {
        InvoiceMetadata metadata = extractor.extract(document("Nothing to see here"));

        assertThat(metadata.invoiceNumber()).isNull();
        assertThat(metadata.billingCycleDate()).isNull();
        assertThat(metadata.currency()).isNull();
        assertThat(metadata.missingFields()).containsExactly("invoice_number", "billing_cycle_date", "currency");
    }

    @Test
    void emptyDocumentYieldsEmptyMetadata() {
        assertThat(extractor.extract(new InvoiceDocument("empty", List.of()))).isEqualTo(InvoiceMetadata.empty());
    }

    private static InvoiceDocument document(String... paragraphs) {
        return InvoiceDocument.ofParagraphs("test.html", List.of(paragraphs));
    }
}
