package com.example.invoicepipeline.infrastructure.storage;

import java.math.BigInteger;

/**
 * De-duplication index of already processed source files and invoice numbers.
 */
public interface ProcessedInvoiceIndex {

    boolean containsFile(String fileId);

    boolean containsInvoice(BigInteger invoiceNumber);

    /**
     * Records a successfully persisted document.
     *
     * @param fileId        source file identifier
     * @param invoiceNumber invoice number extracted from that file
     */
    void record(String fileId, BigInteger invoiceNumber);
}
