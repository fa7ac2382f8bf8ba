package com.skillq.skill.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillq.skill.CancellationSource;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.SkillContext;
import com.skillq.skill.SkillResult;
import com.skillq.spi.DocumentAccessor;
import com.skillq.spi.PlainTextSanitizer;
import com.skillq.spi.StructuredExtractor;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.Project;
import com.skillq.subject.ProjectFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class BatchExtractorSkillTest {

    private DocumentAccessor documentAccessor;
    private StructuredExtractor extractor;
    private BatchExtractorSkill skill;
    private Project project;

    @BeforeEach
    void setUp() {
        documentAccessor = mock(DocumentAccessor.class);
        extractor = mock(StructuredExtractor.class);
        skill = new BatchExtractorSkill(documentAccessor, extractor, new PlainTextSanitizer(255));
        project = SkillFixtures.project(150, EquipmentType.COMPACTOR);
    }

    @Test
    void collectsRecordsFromEveryFileAndAddsUsage() throws Exception {
        ProjectFile invoices = file("march-invoice.pdf", "invoice", "p/1");
        ProjectFile hauls = file("haul-log.csv", "csv", "p/2");
        when(documentAccessor.read(any())).thenReturn("content".getBytes(StandardCharsets.UTF_8));
        when(extractor.extract(any())).thenAnswer(invocation -> {
            StructuredExtractor.Document document = invocation.getArgument(0);
            if (document.fileName().endsWith(".pdf")) {
                return new StructuredExtractor.Extraction(
                        json("{\"invoices\":[{\"invoice_number\":\"INV-1\"},{\"invoice_number\":\"INV-2\"}]}"),
                        new ResourceUsage(1, 1200, 300, 0.02));
            }
            return new StructuredExtractor.Extraction(json("{\"haulLogs\":[{\"tonnage\":5.2}]}"),
                    new ResourceUsage(1, 800, 200, 0.01));
        });

        SkillResult<BatchExtractionResult> result = skill.execute(context(invoices, hauls).build());

        assertTrue(result.success());
        BatchExtractionResult data = result.data();
        assertEquals(2, data.invoices().size());
        assertEquals(1, data.haulLogs().size());
        assertEquals(new BatchExtractionResult.Summary(2, 2, 1, 0), data.summary());
        assertEquals(2, data.processingDetails().get(0).extractedRecords());
        assertEquals(2, result.metadata().resourceUsage().requests());
        assertEquals(0.03, result.metadata().resourceUsage().costUsd(), 1e-9);
    }

    @Test
    void failedFileIsRecordedAndBatchContinues() throws Exception {
        ProjectFile broken = file("scan.pdf", "invoice", "p/broken");
        ProjectFile good = file("april-invoice.pdf", "invoice", "p/good");
        when(documentAccessor.read("p/broken")).thenThrow(new IOException("object missing"));
        when(documentAccessor.read("p/good")).thenReturn(new byte[] { 1 });
        when(extractor.extract(any())).thenReturn(
                new StructuredExtractor.Extraction(json("{\"invoices\":[{}]}"), null));

        BatchExtractionResult data = skill.execute(context(broken, good).build()).data();

        assertEquals(1, data.summary().failedFiles());
        BatchExtractionResult.FileOutcome failed = data.processingDetails().get(0);
        assertEquals(BatchExtractionResult.Status.FAILED, failed.status());
        assertEquals("object missing", failed.error());
        BatchExtractionResult.FileOutcome succeeded = data.processingDetails().get(1);
        assertEquals(BatchExtractionResult.Status.SUCCESS, succeeded.status());
        assertNull(succeeded.error());
    }

    @Test
    void batchFailsWhenEveryFileFails() throws Exception {
        when(documentAccessor.read(any())).thenThrow(new IOException("storage offline"));

        SkillResult<BatchExtractionResult> result = skill.execute(
                context(file("a.pdf", "invoice", "p/a"), file("b.pdf", "invoice", "p/b")).build());

        assertFalse(result.success());
        assertEquals(BatchExtractorSkill.EXTRACTION_FAILED, result.error().code());
        assertTrue(result.error().retryable());
        assertEquals(2, result.error().details().get("failedFiles"));
    }

    @Test
    void failedBatchStillReportsBilledUsage() throws Exception {
        when(documentAccessor.read(any())).thenReturn(new byte[0]);
        when(extractor.extract(any())).thenThrow(new StructuredExtractor.ExtractionException(
                "response was not valid JSON", new ResourceUsage(1, 900, 40, 0.05)));

        SkillResult<BatchExtractionResult> result = skill.execute(
                context(file("a.pdf", "invoice", "p/a"), file("b.pdf", "invoice", "p/b")).build());

        assertFalse(result.success());
        assertEquals(BatchExtractorSkill.EXTRACTION_FAILED, result.error().code());
        ResourceUsage usage = result.metadata().resourceUsage();
        assertEquals(2, usage.requests());
        assertEquals(1800, usage.tokensInput());
        assertEquals(0.1, usage.costUsd(), 1e-9);
    }

    @Test
    void progressAdvancesPerFile() throws Exception {
        when(documentAccessor.read(any())).thenReturn(new byte[0]);
        when(extractor.extract(any())).thenReturn(new StructuredExtractor.Extraction(json("{}"), null));
        List<Integer> percents = new ArrayList<>();

        skill.execute(context(file("a.csv", "csv", "p/a"), file("b.csv", "csv", "p/b"),
                file("c.csv", "csv", "p/c"), file("d.csv", "csv", "p/d"))
                .progressListener(update -> percents.add(update.percent()))
                .build());

        assertEquals(List.of(0, 31, 53, 74, 95, 100), percents);
    }

    @Test
    void cancellationStopsBeforeNextFile() throws Exception {
        CancellationSource source = new CancellationSource();
        when(documentAccessor.read(any())).thenAnswer(invocation -> {
            source.cancel();
            return new byte[0];
        });
        when(extractor.extract(any())).thenReturn(new StructuredExtractor.Extraction(json("{}"), null));

        SkillResult<BatchExtractionResult> result = skill.execute(
                context(file("a.csv", "csv", "p/a"), file("b.csv", "csv", "p/b"))
                        .cancellationToken(source)
                        .build());

        assertTrue(result.isCancelled());
    }

    @Test
    void projectWithoutFilesFailsValidation() {
        SkillResult<BatchExtractionResult> result = skill.execute(SkillFixtures.context(project).build());

        assertEquals("VALIDATION_ERROR", result.error().code());
        verifyNoInteractions(documentAccessor, extractor);
    }

    private SkillContext.Builder context(ProjectFile... files) {
        return SkillFixtures.context(project).files(List.of(files));
    }

    private ProjectFile file(String name, String type, String path) {
        return new ProjectFile(UUID.randomUUID(), project.getId(), name, type, "application/octet-stream", path);
    }

    private static JsonNode json(String value) throws IOException {
        return SkillFixtures.MAPPER.readTree(value);
    }
}
