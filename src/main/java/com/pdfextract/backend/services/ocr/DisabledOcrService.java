package com.pdfextract.backend.services.ocr;

import java.awt.image.BufferedImage;

public class DisabledOcrService implements OcrService {

    @Override
    public String extractText(BufferedImage image) {
        throw new IllegalStateException("OCR fallback is disabled. Set pdfextract.ocr.fallback=tesseract or google-vision");
    }

    @Override
    public String engineName() {
        return "none";
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
