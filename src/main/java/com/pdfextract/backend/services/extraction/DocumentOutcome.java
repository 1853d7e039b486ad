package com.pdfextract.backend.services.extraction;

/**
 * Per-file result of the extraction pipeline. The job loop turns a {@link Rejected} into a failed
 * {@link DocumentExtraction} and moves on to the next file.
 */
public sealed interface DocumentOutcome permits DocumentOutcome.Extracted, DocumentOutcome.Rejected {

    static DocumentOutcome extracted(DocumentExtraction extraction) {
        return new Extracted(extraction);
    }

    static DocumentOutcome rejected(String reason) {
        return new Rejected(reason);
    }

    record Extracted(DocumentExtraction extraction) implements DocumentOutcome {
    }

    record Rejected(String reason) implements DocumentOutcome {
        public Rejected {
            if (reason == null || reason.isBlank()) {
                reason = "Extraction failed";
            }
        }
    }
}
