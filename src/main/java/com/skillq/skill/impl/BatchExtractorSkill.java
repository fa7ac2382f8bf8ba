package com.skillq.skill.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.error.CancelledException;
import com.skillq.error.SkillExecutionException;
import com.skillq.skill.AbstractSkill;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.SkillContext;
import com.skillq.skill.ValidationIssue;
import com.skillq.spi.ContentSanitizer;
import com.skillq.spi.DocumentAccessor;
import com.skillq.spi.StructuredExtractor;
import com.skillq.subject.ProjectFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Extracts invoice and haul log records from every file uploaded to a project. A file that cannot be
 * read or extracted is recorded as failed and the batch moves on; the batch only fails when no file
 * could be processed.
 */
public class BatchExtractorSkill extends AbstractSkill<BatchExtractionResult> {

    public static final String NAME = "batch-extractor";
    public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";

    private final DocumentAccessor documentAccessor;
    private final StructuredExtractor extractor;
    private final ContentSanitizer sanitizer;

    public BatchExtractorSkill(DocumentAccessor documentAccessor, StructuredExtractor extractor,
            ContentSanitizer sanitizer) {
        this.documentAccessor = documentAccessor;
        this.extractor = extractor;
        this.sanitizer = sanitizer;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String version() {
        return "1.0.0";
    }

    @Override
    public String description() {
        return "Extracts invoices and haul logs from uploaded project documents";
    }

    @Override
    protected void validateInput(SkillContext context, List<ValidationIssue> errors) {
        if (context.files().isEmpty()) {
            errors.add(new ValidationIssue("files",
                    "No files found for this project. Upload files before running extraction.", "MISSING_FILES"));
        }
    }

    @Override
    protected BatchExtractionResult executeInternal(SkillContext context) {
        List<ProjectFile> files = context.files();
        List<JsonNode> invoices = new ArrayList<>();
        List<JsonNode> haulLogs = new ArrayList<>();
        List<BatchExtractionResult.FileOutcome> outcomes = new ArrayList<>(files.size());
        ResourceUsage usage = ResourceUsage.NONE;

        for (int i = 0; i < files.size(); i++) {
            context.checkCancellation();
            ProjectFile file = files.get(i);
            context.reportProgress(progressFor(i, files.size()), "Processing " + sanitizer.sanitize(file.getFileName()));
            try {
                byte[] content = documentAccessor.read(file.getStoragePath());
                StructuredExtractor.Extraction extraction = extractor.extract(new StructuredExtractor.Document(
                        file.getFileName(), file.getFileType(), file.getMimeType(), content));
                usage = usage.plus(extraction.usage());
                int records = collect(extraction.data(), "invoices", invoices) + collect(extraction.data(), "haulLogs",
                        haulLogs);
                outcomes.add(new BatchExtractionResult.FileOutcome(file.getId(), file.getFileName(),
                        file.getFileType(), BatchExtractionResult.Status.SUCCESS, records, null));
                log.debug("Extracted {} records from file {}", records, file.getId());
            } catch (CancelledException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SkillExecutionException("Extraction interrupted", e);
            } catch (Exception e) {
                if (e instanceof StructuredExtractor.ExtractionException billed) {
                    usage = usage.plus(billed.getUsage());
                }
                log.warn("Extraction of file {} ({}) failed: {}", file.getId(), file.getFileName(), e.getMessage());
                outcomes.add(new BatchExtractionResult.FileOutcome(file.getId(), file.getFileName(),
                        file.getFileType(), BatchExtractionResult.Status.FAILED, 0, sanitizer.sanitize(e.getMessage())));
            }
        }

        int failed = (int) outcomes.stream()
                .filter(outcome -> outcome.status() == BatchExtractionResult.Status.FAILED)
                .count();
        if (failed == files.size()) {
            throw new SkillExecutionException("All " + failed + " files failed extraction", EXTRACTION_FAILED, true,
                    Map.of("failedFiles", failed), null, usage);
        }

        BatchExtractionResult.Summary summary = new BatchExtractionResult.Summary(files.size(), invoices.size(),
                haulLogs.size(), failed);
        return new BatchExtractionResult(invoices, haulLogs, outcomes, summary, usage);
    }

    @Override
    protected ResourceUsage resourceUsage(BatchExtractionResult data) {
        return data.aiUsage();
    }

    static int progressFor(int index, int total) {
        return (int) Math.round((index + 1) / (double) total * 85) + 10;
    }

    private static int collect(JsonNode data, String field, List<JsonNode> target) {
        if (data == null) {
            return 0;
        }
        JsonNode records = data.path(field);
        if (!records.isArray()) {
            return 0;
        }
        records.forEach(target::add);
        return records.size();
    }
}
