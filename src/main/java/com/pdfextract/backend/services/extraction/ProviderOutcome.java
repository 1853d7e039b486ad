package com.pdfextract.backend.services.extraction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one provider call: a field mapping, or a failure the chain can act on.
 */
public sealed interface ProviderOutcome permits ProviderOutcome.Fields, ProviderOutcome.Failure {

    String provider();

    static ProviderOutcome fields(String provider, Map<String, FieldValue> values) {
        return new Fields(provider, values);
    }

    static ProviderOutcome failure(String provider, String reason, boolean retryable) {
        return new Failure(provider, reason, retryable);
    }

    record Fields(String provider, Map<String, FieldValue> values) implements ProviderOutcome {
        public Fields {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }
    }

    record Failure(String provider, String reason, boolean retryable) implements ProviderOutcome {
    }
}
