package com.skillq.skill.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.skill.ResourceUsage;

import java.util.List;
import java.util.UUID;

public record BatchExtractionResult(
        List<JsonNode> invoices,
        List<JsonNode> haulLogs,
        List<FileOutcome> processingDetails,
        Summary summary,
        ResourceUsage aiUsage) {

    public BatchExtractionResult {
        invoices = List.copyOf(invoices);
        haulLogs = List.copyOf(haulLogs);
        processingDetails = List.copyOf(processingDetails);
    }

    public record FileOutcome(UUID fileId, String fileName, String fileType, Status status, int extractedRecords,
            String error) {
    }

    public enum Status {
        SUCCESS,
        FAILED
    }

    public record Summary(int totalFilesProcessed, int invoicesExtracted, int haulLogsExtracted, int failedFiles) {
    }
}
