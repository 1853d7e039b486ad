package com.pdfextract.backend.services.ocr;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class OcrConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "pdfextract.ocr", name = "fallback", havingValue = "tesseract", matchIfMissing = true)
    public OcrService tesseractOcrService(OcrProperties ocrProperties) {
        log.info("[OCR] Fallback engine: tesseract language='{}' datapath='{}' renderDpi={} maxPages={}",
                safe(ocrProperties.getTesseract().getLanguage()),
                safe(ocrProperties.getTesseract().getDatapath()),
                ocrProperties.getPdf().getRenderDpi(),
                ocrProperties.getPdf().getMaxPages());
        return new TesseractOcrService(ocrProperties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pdfextract.ocr", name = "fallback", havingValue = "google-vision")
    public OcrService googleVisionOcrService(@Value("${google.cloud.vision.credentials-path:}") String credentialsPath) {
        log.info("[OCR] Fallback engine: google-vision credentialsPath='{}'", safe(credentialsPath));
        return new GoogleVisionOcrService(credentialsPath);
    }

    @Bean
    @ConditionalOnMissingBean(OcrService.class)
    public OcrService disabledOcrService() {
        log.info("[OCR] Fallback engine disabled (pdfextract.ocr.fallback=none)");
        return new DisabledOcrService();
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
