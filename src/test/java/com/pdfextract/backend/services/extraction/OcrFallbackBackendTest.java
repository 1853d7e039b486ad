package com.pdfextract.backend.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.pdfextract.backend.services.ocr.OcrService;

class OcrFallbackBackendTest {

    private final OcrService ocrService = mock(OcrService.class);
    private final OcrFallbackBackend backend = new OcrFallbackBackend(ocrService);

    private static BufferedImage page() {
        return new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
    }

    @Test
    void textSource_returnsTextLayerAsRawText() {
        ProviderOutcome outcome = backend.extract(ExtractionSource.ofText("Invoice 42"), "ignored");

        assertThat(outcome).isInstanceOf(ProviderOutcome.Fields.class);
        var values = ((ProviderOutcome.Fields) outcome).values();
        assertThat(values.get(OcrFallbackBackend.RAW_TEXT).raw()).isEqualTo("Invoice 42");
        assertThat(values.get(OcrFallbackBackend.EXTRACTION_METHOD).raw()).isEqualTo("pdf_text");
        assertThat(values.get(OcrFallbackBackend.NOTE).raw()).isEqualTo(OcrFallbackBackend.MANUAL_PARSING_NOTE);
    }

    @Test
    void imageSource_joinsRecognizedPagesWithMarkers() {
        when(ocrService.isEnabled()).thenReturn(true);
        when(ocrService.engineName()).thenReturn("tesseract");
        when(ocrService.extractText(any())).thenReturn("first page", "  ", "third page\n");

        ProviderOutcome outcome = backend.extract(ExtractionSource.ofImages(List.of(page(), page(), page())), "ignored");

        var values = ((ProviderOutcome.Fields) outcome).values();
        assertThat(values.get(OcrFallbackBackend.RAW_TEXT).raw())
                .isEqualTo("--- Page 1 ---\nfirst page\n\n--- Page 3 ---\nthird page");
        assertThat(values.get(OcrFallbackBackend.EXTRACTION_METHOD).raw()).isEqualTo("tesseract");
    }

    @Test
    void imageSource_withNoRecognizedText_fails() {
        when(ocrService.engineName()).thenReturn("tesseract");
        when(ocrService.extractText(any())).thenReturn("");

        ProviderOutcome outcome = backend.extract(ExtractionSource.ofImages(List.of(page())), "ignored");

        assertThat(outcome).isInstanceOf(ProviderOutcome.Failure.class);
        assertThat(((ProviderOutcome.Failure) outcome).reason()).isEqualTo("tesseract recognized no text");
    }

    @Test
    void supports_imagesOnlyWhenOcrEnabled() {
        ExtractionSource images = ExtractionSource.ofImages(List.of(page()));

        when(ocrService.isEnabled()).thenReturn(false);
        assertThat(backend.supports(images)).isFalse();
        assertThat(backend.supports(ExtractionSource.ofText("t"))).isTrue();

        when(ocrService.isEnabled()).thenReturn(true);
        assertThat(backend.supports(images)).isTrue();
    }
}
