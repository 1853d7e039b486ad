package com.pdfextract.backend.services.pdf;

import static org.assertj.core.api.Assertions.assertThat;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import com.pdfextract.backend.services.ocr.OcrProperties;

class ImagePreprocessorTest {

    private static BufferedImage grayWithSpeck() {
        BufferedImage image = new BufferedImage(9, 9, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = image.createGraphics();
        g.setColor(new Color(200, 200, 200));
        g.fillRect(0, 0, 9, 9);
        g.dispose();
        image.getRaster().setSample(4, 4, 0, 0);
        return image;
    }

    @Test
    void medianFilter_removesIsolatedSpeck() {
        BufferedImage filtered = ImagePreprocessor.medianFilter(grayWithSpeck());

        assertThat(filtered.getRaster().getSample(4, 4, 0)).isEqualTo(200);
    }

    @Test
    void enhanceContrast_pushesPixelsAwayFromMean() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_BYTE_GRAY);
        image.getRaster().setSample(0, 0, 0, 100);
        image.getRaster().setSample(1, 0, 0, 150);

        BufferedImage out = ImagePreprocessor.enhanceContrast(image, 1.5f);

        assertThat(out.getRaster().getSample(0, 0, 0)).isLessThan(100);
        assertThat(out.getRaster().getSample(1, 0, 0)).isGreaterThan(150);
    }

    @Test
    void preprocess_convertsColorPageToGrayscale() {
        BufferedImage rgb = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);

        BufferedImage out = new ImagePreprocessor(new OcrProperties()).preprocess(rgb);

        assertThat(out.getType()).isEqualTo(BufferedImage.TYPE_BYTE_GRAY);
        assertThat(out.getWidth()).isEqualTo(16);
    }

    @Test
    void preprocess_null_isNull() {
        assertThat(new ImagePreprocessor(new OcrProperties()).preprocess(null)).isNull();
    }
}
