package com.pdfextract.backend.services.extraction;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * What a provider extracts from: rendered pages of a scanned PDF, or the text layer of a native one.
 */
public sealed interface ExtractionSource permits ExtractionSource.ImageSource, ExtractionSource.TextSource {

    static ExtractionSource ofImages(List<BufferedImage> pages) {
        return new ImageSource(pages);
    }

    static ExtractionSource ofText(String text) {
        return new TextSource(text);
    }

    record ImageSource(List<BufferedImage> pages) implements ExtractionSource {
        public ImageSource {
            if (pages == null || pages.isEmpty()) {
                throw new IllegalArgumentException("at least one page image is required");
            }
            pages = List.copyOf(pages);
        }
    }

    record TextSource(String text) implements ExtractionSource {
        public TextSource {
            if (text == null) {
                throw new IllegalArgumentException("text is required");
            }
        }
    }
}
