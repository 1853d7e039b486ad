package com.pdfextract.backend.services.ocr;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import javax.imageio.ImageIO;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Feature.Type;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.protobuf.ByteString;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class GoogleVisionOcrService implements OcrService {

    public static final String ENGINE = "google_vision";

    private final String credentialsPath;

    public GoogleVisionOcrService(String credentialsPath) {
        this.credentialsPath = credentialsPath == null ? "" : credentialsPath.trim();
    }

    @Override
    public String engineName() {
        return ENGINE;
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) return "";
        return extractTextFromImage(toPng(image));
    }

    public String extractTextFromImage(byte[] imageBytes) {
        if (imageBytes == null || imageBytes.length == 0) return "";

        long startMs = System.currentTimeMillis();
        log.info("[GoogleVision] Processing image bytes={}", imageBytes.length);

        try (ImageAnnotatorClient client = createClient()) {
            Image image = Image.newBuilder().setContent(ByteString.copyFrom(imageBytes)).build();
            Feature feature = Feature.newBuilder().setType(Type.DOCUMENT_TEXT_DETECTION).build();
            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .addFeatures(feature)
                    .setImage(image)
                    .build();

            BatchAnnotateImagesResponse response = client.batchAnnotateImages(List.of(request));
            if (response == null || response.getResponsesCount() == 0) {
                log.info("[GoogleVision] Empty response (0 responses)");
                return "";
            }

            AnnotateImageResponse r = response.getResponses(0);
            if (r.hasError()) {
                throw new OcrException("Google Vision returned an error: " + r.getError().getMessage(), null);
            }

            String text = "";
            if (r.hasFullTextAnnotation()) {
                text = r.getFullTextAnnotation().getText();
            } else if (r.getTextAnnotationsCount() > 0) {
                text = r.getTextAnnotations(0).getDescription();
            }

            text = text == null ? "" : text;
            log.info("[GoogleVision] Extracted {} chars in {}ms", text.length(), System.currentTimeMillis() - startMs);
            return text;
        } catch (OcrException e) {
            log.warn("[GoogleVision] Extraction failed: {}", e.getMessage());
            throw e;
        } catch (Exception e) {
            log.warn("[GoogleVision] Extraction failed: {}", e.toString());
            throw new OcrException("Google Vision OCR failed", e);
        }
    }

    private ImageAnnotatorClient createClient() throws IOException {
        // ADC (GOOGLE_APPLICATION_CREDENTIALS) unless an explicit credentials file exists.
        if (!credentialsPath.isEmpty()) {
            Path p = Path.of(credentialsPath);
            if (Files.exists(p)) {
                try (InputStream in = Files.newInputStream(p)) {
                    GoogleCredentials credentials = GoogleCredentials.fromStream(in)
                            .createScoped(List.of("https://www.googleapis.com/auth/cloud-platform"));
                    ImageAnnotatorSettings settings = ImageAnnotatorSettings.newBuilder()
                            .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                            .build();
                    return ImageAnnotatorClient.create(settings);
                }
            }
            log.warn("[GoogleVision] credentials-path not found: '{}' (falling back to ADC)", credentialsPath);
        }

        return ImageAnnotatorClient.create();
    }

    private static byte[] toPng(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            ImageIO.write(image, "png", out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new OcrException("Failed to encode image for Google Vision", e);
        }
    }
}
