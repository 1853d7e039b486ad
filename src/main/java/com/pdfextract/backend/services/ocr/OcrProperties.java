package com.pdfextract.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pdfextract.ocr")
public class OcrProperties {

    /**
     * Primary intelligent provider: "gemini" (vision + text) or "openai" (text only).
     */
    private String provider = "gemini";

    /**
     * Recognition engine used when the primary provider fails: "tesseract", "google-vision" or "none".
     */
    private String fallback = "tesseract";

    /**
     * Connect/read timeout applied to provider HTTP clients.
     */
    private int timeoutSeconds = 30;

    /**
     * Attempts per provider for transient failures.
     */
    private int maxRetries = 3;

    private Tesseract tesseract = new Tesseract();

    private Pdf pdf = new Pdf();

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getFallback() {
        return fallback;
    }

    public void setFallback(String fallback) {
        this.fallback = fallback;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Tesseract getTesseract() {
        return tesseract;
    }

    public void setTesseract(Tesseract tesseract) {
        this.tesseract = tesseract;
    }

    public Pdf getPdf() {
        return pdf;
    }

    public void setPdf(Pdf pdf) {
        this.pdf = pdf;
    }

    public static class Tesseract {

        /**
         * Tesseract language(s), e.g. "eng" or "eng+deu".
         */
        private String language = "eng";

        /**
         * Optional path that contains the "tessdata" directory.
         * If empty, Tess4J relies on the OS installation and environment.
         */
        private String datapath = "";

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getDatapath() {
            return datapath;
        }

        public void setDatapath(String datapath) {
            this.datapath = datapath;
        }
    }

    public static class Pdf {

        /**
         * Render DPI for scanned pages.
         */
        private int renderDpi = 300;

        /**
         * Max number of rendered pages handed to a provider.
         */
        private int maxPages = 6;

        private boolean preprocessingEnabled = true;

        private boolean denoise = true;

        private boolean contrast = true;

        public int getRenderDpi() {
            return renderDpi;
        }

        public void setRenderDpi(int renderDpi) {
            this.renderDpi = renderDpi;
        }

        public int getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = maxPages;
        }

        public boolean isPreprocessingEnabled() {
            return preprocessingEnabled;
        }

        public void setPreprocessingEnabled(boolean preprocessingEnabled) {
            this.preprocessingEnabled = preprocessingEnabled;
        }

        public boolean isDenoise() {
            return denoise;
        }

        public void setDenoise(boolean denoise) {
            this.denoise = denoise;
        }

        public boolean isContrast() {
            return contrast;
        }

        public void setContrast(boolean contrast) {
            this.contrast = contrast;
        }
    }
}
