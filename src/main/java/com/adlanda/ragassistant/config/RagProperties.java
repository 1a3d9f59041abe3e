package com.adlanda.ragassistant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for ingestion, retrieval and answer generation.
 *
 * Maps to properties prefixed with 'assistant' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "assistant")
public class RagProperties {

    /**
     * Time zone used to render message timestamps as readable dates.
     */
    private String timeZone = "UTC";

    private final Chunking chunking = new Chunking();
    private final Retrieval retrieval = new Retrieval();
    private final Generation generation = new Generation();
    private final Ingestion ingestion = new Ingestion();
    private final Store store = new Store();

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public Chunking getChunking() {
        return chunking;
    }

    public Retrieval getRetrieval() {
        return retrieval;
    }

    public Generation getGeneration() {
        return generation;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public Store getStore() {
        return store;
    }

    public static class Chunking {

        /**
         * Maximum chunk length in characters.
         */
        private int size = 1000;

        /**
         * Characters shared between consecutive chunks. Must be smaller than size.
         */
        private int overlap = 100;

        public int getSize() {
            return size;
        }

        public void setSize(int size) {
            this.size = size;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    public static class Retrieval {

        /**
         * Number of chunks placed in the answer context.
         */
        private int topK = 8;

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }

    public static class Generation {

        /**
         * Upper bound for a single generation call. The call is cancelled when exceeded.
         */
        private Duration timeout = Duration.ofSeconds(60);

        /**
         * Language answers are written in.
         */
        private String language = "Malaysian Malay (Bahasa Melayu Malaysia)";

        /**
         * Register answers are written in.
         */
        private String register = "clear, professional and easy to understand";

        /**
         * Sentence returned verbatim when the context holds no relevant information.
         */
        private String fallbackAnswer =
                "Maaf, saya tidak mempunyai maklumat tersebut dalam mesej WhatsApp atau dokumen yang saya ada akses.";

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getRegister() {
            return register;
        }

        public void setRegister(String register) {
            this.register = register;
        }

        public String getFallbackAnswer() {
            return fallbackAnswer;
        }

        public void setFallbackAnswer(String fallbackAnswer) {
            this.fallbackAnswer = fallbackAnswer;
        }
    }

    public static class Ingestion {

        /**
         * Skip documents whose file name and content hash are already indexed.
         */
        private boolean incremental = true;

        /**
         * Directory scanned for PDF/DOCX/DOC files at startup. Empty disables the scan.
         */
        private String bootstrapPath = "";

        public boolean isIncremental() {
            return incremental;
        }

        public void setIncremental(boolean incremental) {
            this.incremental = incremental;
        }

        public String getBootstrapPath() {
            return bootstrapPath;
        }

        public void setBootstrapPath(String bootstrapPath) {
            this.bootstrapPath = bootstrapPath;
        }
    }

    public static class Store {

        /**
         * JSON file the in-memory store is loaded from at startup and saved to at shutdown.
         * Empty keeps the store purely in memory.
         */
        private String snapshotPath = "";

        public String getSnapshotPath() {
            return snapshotPath;
        }

        public void setSnapshotPath(String snapshotPath) {
            this.snapshotPath = snapshotPath;
        }
    }
}
