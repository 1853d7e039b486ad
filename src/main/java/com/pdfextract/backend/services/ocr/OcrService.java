package com.pdfextract.backend.services.ocr;

import java.awt.image.BufferedImage;

public interface OcrService {

    /**
     * Extracts text from an image using OCR.
     */
    String extractText(BufferedImage image);

    /**
     * Value reported as {@code extraction_method} for text produced by this engine.
     */
    String engineName();

    default boolean isEnabled() {
        return true;
    }
}
