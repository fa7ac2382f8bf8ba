package com.skillq.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.skill.ResourceUsage;

/**
 * Turns one document into structured records, typically by calling a metered model API.
 * <p>
 * The returned {@code data} holds an {@code invoices} array, a {@code haulLogs} array, or both.
 */
@FunctionalInterface
public interface StructuredExtractor {

    Extraction extract(Document document) throws Exception;

    record Document(String fileName, String fileType, String mimeType, byte[] content) {
    }

    record Extraction(JsonNode data, ResourceUsage usage) {

        public Extraction {
            usage = usage == null ? ResourceUsage.NONE : usage;
        }
    }

    /**
     * The provider was called and billed, but its output could not be turned into records.
     */
    class ExtractionException extends Exception {

        private final ResourceUsage usage;

        public ExtractionException(String message, ResourceUsage usage) {
            this(message, usage, null);
        }

        public ExtractionException(String message, ResourceUsage usage, Throwable cause) {
            super(message, cause);
            this.usage = usage == null ? ResourceUsage.NONE : usage;
        }

        public ResourceUsage getUsage() {
            return usage;
        }
    }
}
