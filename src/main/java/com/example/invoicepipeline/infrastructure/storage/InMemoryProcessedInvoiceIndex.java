package com.example.invoicepipeline.infrastructure.storage;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local index. Forgets everything on restart, so it only de-duplicates within one running instance.
 */
@Component
public class InMemoryProcessedInvoiceIndex implements ProcessedInvoiceIndex {

    private final Set<String> fileIds = ConcurrentHashMap.newKeySet();
    private final Set<BigInteger> invoiceNumbers = ConcurrentHashMap.newKeySet();

    @Override
    public boolean containsFile(String fileId) {
        return fileIds.contains(fileId);
    }

    @Override
    public boolean containsInvoice(BigInteger invoiceNumber) {
        return invoiceNumbers.contains(invoiceNumber);
    }

    @Override
    public void record(String fileId, BigInteger invoiceNumber) {
        fileIds.add(fileId);
        invoiceNumbers.add(invoiceNumber);
    }
}
