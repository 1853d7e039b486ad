package com.pdfextract.backend.services.extraction;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.responses.Response;
import com.openai.models.responses.ResponseCreateParams;
import com.openai.models.responses.ResponseOutputItem;
import com.pdfextract.backend.services.ocr.OcrProperties;

import lombok.extern.slf4j.Slf4j;

/**
 * Text-only provider on the OpenAI Responses API. Scanned pages are left to the next backend in the chain.
 */
@Slf4j
@Component
public class OpenAiExtractionBackend extends AbstractExtractionBackend {

    public static final String NAME = "openai";

    @Value("${openai.api-key:}")
    private String apiKey;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.max-tokens:2000}")
    private int maxTokens;

    @Value("${openai.temperature:0.1}")
    private double temperature;

    private final OcrProperties ocrProperties;
    private final JsonResponseParser responseParser;

    private volatile OpenAIClient client;

    public OpenAiExtractionBackend(OcrProperties ocrProperties, JsonResponseParser responseParser) {
        this.ocrProperties = ocrProperties;
        this.responseParser = responseParser;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(ExtractionSource source) {
        return source instanceof ExtractionSource.TextSource;
    }

    @Override
    protected Map<String, FieldValue> doExtract(ExtractionSource source, String instruction) {
        if (!(source instanceof ExtractionSource.TextSource text)) {
            throw new ProviderException("OpenAI backend only accepts text input", false);
        }

        String key = apiKey == null ? "" : apiKey.trim();
        if (key.isEmpty()) {
            throw new ProviderException("OPENAI_API_KEY not configured", false);
        }

        ResponseCreateParams params = ResponseCreateParams.builder()
                .model(model)
                .input(instruction + "\n\nDocument text:\n" + text.text())
                .maxOutputTokens(maxTokens)
                .temperature(temperature)
                .build();

        String output;
        try {
            Response response = getOrCreateClient(key).responses().create(params);
            output = extractOutputText(response);
        } catch (OpenAIServiceException e) {
            int status = e.statusCode();
            throw new ProviderException("OpenAI HTTP " + status + ": " + e.getMessage(), status == 429 || status >= 500, e);
        } catch (OpenAIIoException e) {
            throw new ProviderException("OpenAI unreachable: " + e.getMessage(), true, e);
        }

        if (output.isBlank()) {
            throw new ProviderException("OpenAI returned an empty response", false);
        }
        log.debug("[OpenAI] Raw response: {}", JsonResponseParser.abbreviate(output, 500));
        return responseParser.parse(output);
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .timeout(Duration.ofSeconds(Math.max(1, ocrProperties.getTimeoutSeconds())))
                    // Retries are driven by the extraction chain.
                    .maxRetries(0)
                    .build();
            return client;
        }
    }

    private static String extractOutputText(Response response) {
        if (response == null) return "";
        StringBuilder sb = new StringBuilder();
        List<ResponseOutputItem> output = response.output();
        if (output == null || output.isEmpty()) return "";

        for (ResponseOutputItem item : output) {
            if (item == null) continue;
            item.message().ifPresent(message -> {
                if (message.content() == null) return;
                for (var content : message.content()) {
                    if (content == null) continue;
                    content.outputText().ifPresent(t -> {
                        String v = t.text();
                        if (v != null && !v.isBlank()) {
                            if (!sb.isEmpty()) sb.append('\n');
                            sb.append(v);
                        }
                    });
                }
            });
        }
        return sb.toString();
    }
}
