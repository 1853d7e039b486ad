package com.pdfextract.backend.services.pdf;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import com.pdfextract.backend.services.ocr.OcrProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inspects a PDF on disk: decides whether it has a usable text layer, pulls that text, or renders
 * the pages for image based extraction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentAnalyzer {

    static final int SAMPLE_PAGES = 3;
    static final int MIN_CHARS_PER_PAGE = 50;

    private final PdfTextExtractor pdfTextExtractor;
    private final ImagePreprocessor imagePreprocessor;
    private final OcrProperties ocrProperties;

    /**
     * Averages the extracted characters over the first (at most three) pages. Anything that cannot be
     * read is treated as scanned, so the image path is always attempted.
     */
    public PdfKind classify(Path path) {
        try (PDDocument document = PDDocument.load(path.toFile())) {
            int sampled = Math.min(SAMPLE_PAGES, document.getNumberOfPages());
            if (sampled == 0) {
                log.info("[PdfAnalyzer] {} has no pages, treating as scanned", path.getFileName());
                return PdfKind.SCANNED;
            }

            int chars = 0;
            for (int page = 1; page <= sampled; page++) {
                String text = pdfTextExtractor.extractPageText(document, page);
                if (text != null) {
                    chars += text.strip().length();
                }
            }

            double avgPerPage = (double) chars / sampled;
            PdfKind kind = avgPerPage < MIN_CHARS_PER_PAGE ? PdfKind.SCANNED : PdfKind.TEXT;
            log.info("[PdfAnalyzer] file={} sampledPages={} avgCharsPerPage={} kind={}",
                    path.getFileName(), sampled, Math.round(avgPerPage), kind);
            return kind;
        } catch (Exception e) {
            log.warn("[PdfAnalyzer] Could not inspect {} ({}), treating as scanned", path.getFileName(), e.toString());
            return PdfKind.SCANNED;
        }
    }

    /**
     * Full text with "--- Page n ---" markers, or {@code null} when no page has any text.
     */
    public String extractText(Path path) {
        try (PDDocument document = PDDocument.load(path.toFile())) {
            List<String> parts = new ArrayList<>();
            int pages = document.getNumberOfPages();
            for (int page = 1; page <= pages; page++) {
                String text = pdfTextExtractor.extractPageText(document, page);
                if (text != null && !text.isBlank()) {
                    parts.add("--- Page " + page + " ---\n" + text.strip());
                }
            }

            String fullText = String.join("\n\n", parts);
            log.info("[PdfAnalyzer] Extracted {} characters from {} pages of {}", fullText.length(), pages, path.getFileName());
            return fullText.isEmpty() ? null : fullText;
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to extract text from PDF: " + e.getMessage(), e);
        }
    }

    public List<BufferedImage> rasterize(Path path) {
        return rasterize(path, ocrProperties.getPdf().getRenderDpi());
    }

    /**
     * Renders every page at {@code dpi}; pages go through {@link ImagePreprocessor} when enabled.
     */
    public List<BufferedImage> rasterize(Path path, int dpi) {
        int effectiveDpi = Math.max(72, dpi);
        boolean preprocess = ocrProperties.getPdf().isPreprocessingEnabled();
        long startMs = System.currentTimeMillis();

        try (PDDocument document = PDDocument.load(path.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = document.getNumberOfPages();
            List<BufferedImage> images = new ArrayList<>(pages);

            for (int pageIndex = 0; pageIndex < pages; pageIndex++) {
                BufferedImage image = renderer.renderImageWithDPI(pageIndex, effectiveDpi, ImageType.RGB);
                images.add(preprocess ? imagePreprocessor.preprocess(image) : image);
            }

            log.info("[PdfAnalyzer] Rendered {} pages of {} dpi={} preprocess={} elapsedMs={}",
                    pages, path.getFileName(), effectiveDpi, preprocess, System.currentTimeMillis() - startMs);
            return images;
        } catch (IOException e) {
            throw new PdfProcessingException("Failed to convert PDF to images: " + e.getMessage(), e);
        }
    }
}
