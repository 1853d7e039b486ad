package com.pdfextract.backend.services.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.services.fields.FieldSchemaRegistry;
import com.pdfextract.backend.services.ocr.OcrProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs an ordered chain of {@link ExtractionBackend}s: the configured primary provider, then the OCR
 * fallback. The first backend that yields fields wins; its mapping is returned as is, never merged
 * with another backend's output.
 */
@Service
@Slf4j
public class ExtractionStrategy {

    static final String CHAIN = "chain";

    // 400ms, 1200ms, 2800ms
    private static final long[] DEFAULT_BACKOFF_MS = {400, 1200, 2800};

    private final List<ExtractionBackend> chain;
    private final FieldSchemaRegistry fieldSchemaRegistry;
    private final int maxAttempts;
    private final long[] backoffMs;

    @Autowired
    public ExtractionStrategy(List<ExtractionBackend> backends,
                              FieldSchemaRegistry fieldSchemaRegistry,
                              OcrProperties ocrProperties) {
        this(orderChain(backends, ocrProperties.getProvider()), fieldSchemaRegistry,
                ocrProperties.getMaxRetries(), DEFAULT_BACKOFF_MS);
    }

    ExtractionStrategy(List<ExtractionBackend> chain, FieldSchemaRegistry fieldSchemaRegistry,
                       int maxAttempts, long[] backoffMs) {
        this.chain = List.copyOf(chain);
        this.fieldSchemaRegistry = fieldSchemaRegistry;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = backoffMs == null ? new long[0] : backoffMs.clone();
        log.info("[Extraction] Provider chain={} maxAttempts={}",
                this.chain.stream().map(ExtractionBackend::name).toList(), this.maxAttempts);
    }

    public List<String> chainNames() {
        return chain.stream().map(ExtractionBackend::name).toList();
    }

    public ProviderOutcome extract(ExtractionSource source, DocumentType documentType, List<String> customFields) {
        String instruction = fieldSchemaRegistry.buildInstruction(documentType, customFields);
        List<String> reasons = new ArrayList<>();

        for (ExtractionBackend backend : chain) {
            if (!backend.supports(source)) {
                log.debug("[Extraction] Skipping {}: source not supported", backend.name());
                continue;
            }

            ProviderOutcome outcome = callWithRetries(backend, source, instruction);
            if (outcome instanceof ProviderOutcome.Fields fields) {
                if (!reasons.isEmpty()) {
                    log.info("[Extraction] Fell back to {} after: {}", backend.name(), String.join("; ", reasons));
                }
                return fields;
            }

            ProviderOutcome.Failure failure = (ProviderOutcome.Failure) outcome;
            reasons.add(backend.name() + ": " + failure.reason());
        }

        if (reasons.isEmpty()) {
            reasons.add("no provider supports this document source");
        }
        String reason = String.join("; ", reasons);
        log.warn("[Extraction] All providers failed: {}", reason);
        return ProviderOutcome.failure(CHAIN, reason, false);
    }

    private ProviderOutcome callWithRetries(ExtractionBackend backend, ExtractionSource source, String instruction) {
        ProviderOutcome.Failure last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ProviderOutcome outcome = backend.extract(source, instruction);

            if (outcome instanceof ProviderOutcome.Fields fields) {
                if (!fields.values().isEmpty()) {
                    return fields;
                }
                return ProviderOutcome.failure(backend.name(), "empty response", false);
            }

            last = (ProviderOutcome.Failure) outcome;
            if (!last.retryable() || attempt >= maxAttempts) {
                break;
            }
            log.info("[Extraction] {} attempt {}/{} failed, retrying: {}", backend.name(), attempt, maxAttempts, last.reason());
            sleepBackoff(attempt);
        }
        return last;
    }

    private void sleepBackoff(int attempt) {
        if (backoffMs.length == 0) return;
        long ms = backoffMs[Math.min(attempt, backoffMs.length) - 1];
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    static List<ExtractionBackend> orderChain(List<ExtractionBackend> backends, String provider) {
        String wanted = provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);

        ExtractionBackend primary = backends.stream()
                .filter(b -> b.name().equals(wanted))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown extraction provider: '" + provider + "'"));

        List<ExtractionBackend> ordered = new ArrayList<>();
        ordered.add(primary);
        backends.stream()
                .filter(b -> OcrFallbackBackend.NAME.equals(b.name()))
                .findFirst()
                .ifPresent(ordered::add);
        return ordered;
    }
}
