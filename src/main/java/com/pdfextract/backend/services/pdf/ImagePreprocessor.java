package com.pdfextract.backend.services.pdf;

import java.awt.image.BufferedImage;
import java.awt.image.ConvolveOp;
import java.awt.image.Kernel;
import java.awt.image.WritableRaster;
import java.util.Arrays;

import org.springframework.stereotype.Component;

import com.pdfextract.backend.services.ocr.OcrProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.util.ImageHelper;

/**
 * Filter chain applied to rendered pages before recognition:
 * grayscale, optional 3x3 median denoise, optional contrast boost, sharpening.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImagePreprocessor {

    static final float CONTRAST_FACTOR = 1.5f;
    static final float SHARPNESS_FACTOR = 1.3f;

    private final OcrProperties ocrProperties;

    public BufferedImage preprocess(BufferedImage image) {
        if (image == null) return null;

        OcrProperties.Pdf settings = ocrProperties.getPdf();
        try {
            BufferedImage out = toGrayscale(image);
            if (settings.isDenoise()) {
                out = medianFilter(out);
            }
            if (settings.isContrast()) {
                out = enhanceContrast(out, CONTRAST_FACTOR);
            }
            return sharpen(out, SHARPNESS_FACTOR);
        } catch (RuntimeException e) {
            log.warn("[Preprocess] Failed, keeping unmodified page: {}", e.toString());
            return image;
        }
    }

    static BufferedImage toGrayscale(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            return image;
        }
        return ImageHelper.convertImageToGrayscale(image);
    }

    static BufferedImage medianFilter(BufferedImage gray) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        WritableRaster src = gray.getRaster();
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster dst = out.getRaster();

        int[] window = new int[9];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int yy = clamp(y + dy, 0, h - 1);
                    for (int dx = -1; dx <= 1; dx++) {
                        int xx = clamp(x + dx, 0, w - 1);
                        window[n++] = src.getSample(xx, yy, 0);
                    }
                }
                Arrays.sort(window);
                dst.setSample(x, y, 0, window[4]);
            }
        }
        return out;
    }

    /**
     * Scales every pixel away from the mean gray level by {@code factor}.
     */
    static BufferedImage enhanceContrast(BufferedImage gray, float factor) {
        int w = gray.getWidth();
        int h = gray.getHeight();
        WritableRaster src = gray.getRaster();

        long total = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                total += src.getSample(x, y, 0);
            }
        }
        long pixels = (long) w * h;
        double mean = pixels == 0 ? 0 : (double) total / pixels;

        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster dst = out.getRaster();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                double v = mean + factor * (src.getSample(x, y, 0) - mean);
                dst.setSample(x, y, 0, clamp((int) Math.round(v), 0, 255));
            }
        }
        return out;
    }

    /**
     * Blends the page with a smoothed copy of itself, i.e. {@code smooth + factor * (page - smooth)},
     * folded into a single 3x3 kernel.
     */
    static BufferedImage sharpen(BufferedImage gray, float factor) {
        float edge = -(factor - 1f) / 13f;
        float center = factor - (factor - 1f) * 5f / 13f;
        float[] kernel = {
                edge, edge, edge,
                edge, center, edge,
                edge, edge, edge
        };
        ConvolveOp op = new ConvolveOp(new Kernel(3, 3, kernel), ConvolveOp.EDGE_NO_OP, null);
        BufferedImage out = new BufferedImage(gray.getWidth(), gray.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        return op.filter(gray, out);
    }

    private static int clamp(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
