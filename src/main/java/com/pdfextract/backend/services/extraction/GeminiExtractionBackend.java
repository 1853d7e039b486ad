package com.pdfextract.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;

import javax.imageio.ImageIO;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Vision and text capable provider backed by the Gemini generateContent REST endpoint.
 */
@Slf4j
@Component
public class GeminiExtractionBackend extends AbstractExtractionBackend {

    public static final String NAME = "gemini";

    private final RestTemplate restTemplate;
    private final JsonResponseParser responseParser;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final String apiKey;
    private final String model;
    private final String endpoint;

    @Autowired
    public GeminiExtractionBackend(ObjectProvider<RestTemplate> restTemplateProvider,
                                   JsonResponseParser responseParser,
                                   @Value("${gemini.api-key:}") String apiKey,
                                   @Value("${gemini.model:gemini-1.5-flash}") String model,
                                   @Value("${gemini.endpoint:https://generativelanguage.googleapis.com/v1beta}") String endpoint) {
        this(restTemplateProvider != null ? restTemplateProvider.getIfAvailable() : null,
                responseParser, apiKey, model, endpoint);
    }

    // Constructor for unit tests (no Spring).
    GeminiExtractionBackend(RestTemplate restTemplate, JsonResponseParser responseParser,
                            String apiKey, String model, String endpoint) {
        this.restTemplate = restTemplate;
        this.responseParser = responseParser;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.model = model;
        this.endpoint = endpoint;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(ExtractionSource source) {
        return source != null;
    }

    public boolean isConfigured() {
        return !apiKey.isEmpty() && restTemplate != null;
    }

    @Override
    protected Map<String, FieldValue> doExtract(ExtractionSource source, String instruction) {
        if (!isConfigured()) {
            throw new ProviderException("Gemini API key not configured", false);
        }

        String content = generateContent(buildRequest(source, instruction));
        if (content == null || content.isBlank()) {
            throw new ProviderException("Gemini returned an empty response", false);
        }
        log.debug("[Gemini] Raw response: {}", JsonResponseParser.abbreviate(content, 500));
        return responseParser.parse(content);
    }

    ObjectNode buildRequest(ExtractionSource source, String instruction) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode parts = body.putArray("contents").addObject().putArray("parts");

        if (source instanceof ExtractionSource.TextSource text) {
            parts.addObject().put("text", instruction + "\n\nDocument text:\n" + text.text());
        } else if (source instanceof ExtractionSource.ImageSource images) {
            parts.addObject().put("text", instruction);
            for (BufferedImage page : images.pages()) {
                ObjectNode inline = parts.addObject().putObject("inline_data");
                inline.put("mime_type", "image/png");
                inline.put("data", toBase64Png(page));
            }
        }

        body.putObject("generationConfig").put("temperature", 0.1);
        return body;
    }

    private String generateContent(ObjectNode requestBody) {
        String base = endpoint == null ? "" : endpoint;
        String url = (base.endsWith("/") ? base : base + "/") + "models/" + model + ":generateContent";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        try {
            String response = restTemplate.postForObject(url, new HttpEntity<>(requestBody.toString(), headers), String.class);
            return response == null ? null : readCandidateText(response);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            boolean retryable = status == 429 || e.getStatusCode().is5xxServerError();
            throw new ProviderException("Gemini HTTP " + status + ": " + e.getStatusText(), retryable, e);
        } catch (ResourceAccessException e) {
            throw new ProviderException("Gemini unreachable: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new ProviderException("Gemini call failed: " + e.getMessage(), false, e);
        }
    }

    private String readCandidateText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
            StringBuilder sb = new StringBuilder();
            for (JsonNode part : parts) {
                String text = part.path("text").asText("");
                if (!text.isBlank()) {
                    if (!sb.isEmpty()) sb.append('\n');
                    sb.append(text);
                }
            }
            return sb.toString();
        } catch (IOException e) {
            throw new ProviderException("Gemini returned a malformed envelope", false, e);
        }
    }

    private static String toBase64Png(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (IOException e) {
            throw new ProviderException("Failed to encode page image", false, e);
        }
    }
}
