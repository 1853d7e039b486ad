package com.pdfextract.backend.services.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import com.pdfextract.backend.enums.DocumentType;
import com.pdfextract.backend.services.ocr.OcrProperties;
import com.pdfextract.backend.services.pdf.DocumentAnalyzer;
import com.pdfextract.backend.services.pdf.PdfKind;
import com.pdfextract.backend.services.pdf.PdfProcessingException;

class DocumentExtractorTest {

    private static final Path FILE = Path.of("uploads", "f1_invoice.pdf");

    private final DocumentAnalyzer analyzer = mock(DocumentAnalyzer.class);
    private final ExtractionStrategy strategy = mock(ExtractionStrategy.class);
    private final OcrProperties ocrProperties = new OcrProperties();
    private final DocumentExtractor extractor =
            new DocumentExtractor(analyzer, strategy, new DocumentTypeClassifier(), ocrProperties);

    @Test
    void textPdf_isExtractedFromTextLayer_keepingRequestedType() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.TEXT);
        when(analyzer.extractText(FILE)).thenReturn("--- Page 1 ---\nAccount 99 consumption 120");
        when(strategy.extract(any(), eq(DocumentType.INVOICE), anyList())).thenReturn(ProviderOutcome.fields("gemini",
                Map.of("account_number", FieldValue.text("99"), "consumption", FieldValue.text("120"))));

        DocumentOutcome outcome = extractor.extract("f1", "invoice.pdf", FILE, DocumentType.INVOICE, List.of());

        DocumentExtraction extraction = ((DocumentOutcome.Extracted) outcome).extraction();
        assertThat(extraction.success()).isTrue();
        assertThat(extraction.documentType()).isEqualTo(DocumentType.INVOICE);
        assertThat(extraction.fields()).extracting(ExtractedField::fieldName)
                .containsExactlyInAnyOrder("account_number", "consumption");
        verify(analyzer, never()).rasterize(any());
    }

    @Test
    void unknownRequestedType_isReplacedByDetectedType() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.TEXT);
        when(analyzer.extractText(FILE)).thenReturn("text");
        when(strategy.extract(any(), any(), any())).thenReturn(ProviderOutcome.fields("gemini",
                Map.of("account_number", FieldValue.text("99"), "consumption", FieldValue.text("120"))));

        DocumentOutcome outcome = extractor.extract("f1", "bill.pdf", FILE, DocumentType.UNKNOWN, null);

        assertThat(((DocumentOutcome.Extracted) outcome).extraction().documentType())
                .isEqualTo(DocumentType.UTILITY_BILL);
    }

    @Test
    void textPdfWithoutText_isRejected() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.TEXT);
        when(analyzer.extractText(FILE)).thenReturn(null);

        DocumentOutcome outcome = extractor.extract("f1", "a.pdf", FILE, DocumentType.INVOICE, null);

        assertThat(outcome).isEqualTo(DocumentOutcome.rejected("Failed to extract text from PDF"));
    }

    @Test
    void scannedPdf_sendsAtMostMaxPagesImages() {
        ocrProperties.getPdf().setMaxPages(2);
        List<BufferedImage> pages = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            pages.add(new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY));
        }
        when(analyzer.classify(FILE)).thenReturn(PdfKind.SCANNED);
        when(analyzer.rasterize(FILE)).thenReturn(pages);
        when(strategy.extract(any(), any(), any()))
                .thenReturn(ProviderOutcome.fields("gemini", Map.of("invoice_number", FieldValue.text("1"))));

        extractor.extract("f1", "scan.pdf", FILE, DocumentType.INVOICE, null);

        ArgumentCaptor<ExtractionSource> source = ArgumentCaptor.forClass(ExtractionSource.class);
        verify(strategy).extract(source.capture(), eq(DocumentType.INVOICE), any());
        assertThat(((ExtractionSource.ImageSource) source.getValue()).pages()).hasSize(2);
    }

    @Test
    void scannedPdfWithoutPages_isRejected() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.SCANNED);
        when(analyzer.rasterize(FILE)).thenReturn(List.of());

        DocumentOutcome outcome = extractor.extract("f1", "scan.pdf", FILE, DocumentType.INVOICE, null);

        assertThat(((DocumentOutcome.Rejected) outcome).reason()).isEqualTo("Failed to convert PDF to images");
    }

    @Test
    void providerChainFailure_isRejectedWithItsReason() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.TEXT);
        when(analyzer.extractText(FILE)).thenReturn("text");
        when(strategy.extract(any(), any(), any()))
                .thenReturn(ProviderOutcome.failure("chain", "gemini: HTTP 400; ocr-fallback: boom", false));

        DocumentOutcome outcome = extractor.extract("f1", "a.pdf", FILE, DocumentType.INVOICE, null);

        assertThat(((DocumentOutcome.Rejected) outcome).reason()).isEqualTo("gemini: HTTP 400; ocr-fallback: boom");
    }

    @Test
    void renderingError_isRejectedNotThrown() {
        when(analyzer.classify(FILE)).thenReturn(PdfKind.SCANNED);
        when(analyzer.rasterize(FILE)).thenThrow(new PdfProcessingException("Failed to convert PDF to images: bad xref", null));

        DocumentOutcome outcome = extractor.extract("f1", "a.pdf", FILE, DocumentType.INVOICE, null);

        assertThat(((DocumentOutcome.Rejected) outcome).reason()).contains("bad xref");
    }
}
