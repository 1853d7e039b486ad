package com.pdfextract.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.services.ocr.OcrProperties;
import com.pdfextract.backend.services.pdf.DocumentAnalyzer;
import com.pdfextract.backend.services.pdf.PdfKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one file through analysis, provider extraction and type detection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentExtractor {

    private final DocumentAnalyzer documentAnalyzer;
    private final ExtractionStrategy extractionStrategy;
    private final DocumentTypeClassifier documentTypeClassifier;
    private final OcrProperties ocrProperties;

    public DocumentOutcome extract(String fileId, String filename, Path path,
                                   DocumentType requestedType, List<String> customFields) {
        DocumentType type = requestedType == null ? DocumentType.UNKNOWN : requestedType;
        long startMs = System.currentTimeMillis();

        try {
            PdfKind kind = documentAnalyzer.classify(path);
            ExtractionSource source = kind == PdfKind.TEXT ? textSource(path) : imageSource(path);
            if (source == null) {
                return DocumentOutcome.rejected(kind == PdfKind.TEXT
                        ? "Failed to extract text from PDF"
                        : "Failed to convert PDF to images");
            }

            ProviderOutcome outcome = extractionStrategy.extract(source, type, customFields);
            if (outcome instanceof ProviderOutcome.Failure failure) {
                return DocumentOutcome.rejected(failure.reason());
            }

            Map<String, FieldValue> values = ((ProviderOutcome.Fields) outcome).values();
            List<ExtractedField> fields = new ArrayList<>(values.size());
            values.forEach((name, value) -> fields.add(new ExtractedField(name, value)));

            DocumentType detected = documentTypeClassifier.detectType(values);
            DocumentType assigned = type == DocumentType.UNKNOWN ? detected : type;

            log.info("[Extraction] file={} kind={} provider={} fields={} type={} elapsedMs={}",
                    filename, kind, outcome.provider(), fields.size(), assigned.getValue(),
                    System.currentTimeMillis() - startMs);
            return DocumentOutcome.extracted(DocumentExtraction.succeeded(fileId, filename, assigned, fields));
        } catch (RuntimeException e) {
            log.error("[Extraction] file={} failed: {}", filename, e.toString());
            return DocumentOutcome.rejected(e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }

    private ExtractionSource textSource(Path path) {
        String text = documentAnalyzer.extractText(path);
        return text == null || text.isBlank() ? null : ExtractionSource.ofText(text);
    }

    private ExtractionSource imageSource(Path path) {
        List<BufferedImage> pages = documentAnalyzer.rasterize(path);
        if (pages.isEmpty()) {
            return null;
        }
        int maxPages = Math.max(1, ocrProperties.getPdf().getMaxPages());
        if (pages.size() > maxPages) {
            log.info("[Extraction] {} has {} pages, sending the first {}", path.getFileName(), pages.size(), maxPages);
            pages = pages.subList(0, maxPages);
        }
        return ExtractionSource.ofImages(pages);
    }
}
