package com.pdfextract.backend.services.extraction;

import java.util.Map;

import lombok.extern.slf4j.Slf4j;

/**
 * Converts the exceptions thrown by a provider implementation into a {@link ProviderOutcome}.
 */
@Slf4j
public abstract class AbstractExtractionBackend implements ExtractionBackend {

    @Override
    public final ProviderOutcome extract(ExtractionSource source, String instruction) {
        long startMs = System.currentTimeMillis();
        try {
            Map<String, FieldValue> values = doExtract(source, instruction);
            log.info("[{}] Extracted {} fields in {}ms", name(), values.size(), System.currentTimeMillis() - startMs);
            return ProviderOutcome.fields(name(), values);
        } catch (ProviderException e) {
            log.warn("[{}] Provider call failed (retryable={}): {}", name(), e.isRetryable(), e.getMessage());
            return ProviderOutcome.failure(name(), e.getMessage(), e.isRetryable());
        } catch (ResponseParseException e) {
            log.warn("[{}] Unparsable response: {}", name(), e.getMessage());
            return ProviderOutcome.failure(name(), e.getMessage(), false);
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected provider error", name(), e);
            return ProviderOutcome.failure(name(), e.toString(), false);
        }
    }

    protected abstract Map<String, FieldValue> doExtract(ExtractionSource source, String instruction);
}
