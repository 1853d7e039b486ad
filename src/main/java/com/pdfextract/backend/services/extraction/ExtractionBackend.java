package com.pdfextract.backend.services.extraction;

/**
 * One provider in the extraction chain.
 */
public interface ExtractionBackend {

    /**
     * Stable name used in configuration and logs.
     */
    String name();

    boolean supports(ExtractionSource source);

    /**
     * Obtains a field mapping from {@code source}; never throws.
     */
    ProviderOutcome extract(ExtractionSource source, String instruction);
}
