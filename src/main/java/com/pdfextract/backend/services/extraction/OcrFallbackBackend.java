package com.pdfextract.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.pdfextract.backend.services.ocr.OcrService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Last link of the chain. Does not structure anything: it hands back the recognized (or text layer)
 * content as {@code raw_text} and marks how it was obtained.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OcrFallbackBackend extends AbstractExtractionBackend {

    public static final String NAME = "ocr-fallback";

    static final String RAW_TEXT = "raw_text";
    static final String EXTRACTION_METHOD = "extraction_method";
    static final String NOTE = "note";
    static final String PDF_TEXT_METHOD = "pdf_text";
    static final String MANUAL_PARSING_NOTE = "Basic text extraction - may require manual parsing";

    private final OcrService ocrService;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean supports(ExtractionSource source) {
        if (source instanceof ExtractionSource.ImageSource) {
            return ocrService.isEnabled();
        }
        return source instanceof ExtractionSource.TextSource;
    }

    @Override
    protected Map<String, FieldValue> doExtract(ExtractionSource source, String instruction) {
        if (source instanceof ExtractionSource.TextSource text) {
            return rawText(text.text(), PDF_TEXT_METHOD);
        }

        ExtractionSource.ImageSource images = (ExtractionSource.ImageSource) source;
        List<String> pages = new ArrayList<>();
        int pageNumber = 0;
        for (BufferedImage page : images.pages()) {
            pageNumber++;
            String text = ocrService.extractText(page);
            if (text != null && !text.isBlank()) {
                pages.add("--- Page " + pageNumber + " ---\n" + text.strip());
            }
        }

        if (pages.isEmpty()) {
            throw new ProviderException(ocrService.engineName() + " recognized no text", false);
        }
        log.info("[OCR] {} recognized text on {}/{} pages", ocrService.engineName(), pages.size(), images.pages().size());
        return rawText(String.join("\n\n", pages), ocrService.engineName());
    }

    private static Map<String, FieldValue> rawText(String text, String method) {
        Map<String, FieldValue> values = new LinkedHashMap<>();
        values.put(RAW_TEXT, FieldValue.text(text));
        values.put(EXTRACTION_METHOD, FieldValue.text(method));
        values.put(NOTE, FieldValue.text(MANUAL_PARSING_NOTE));
        return values;
    }
}
