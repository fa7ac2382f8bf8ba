package com.skillq.skill.impl;

import com.skillq.skill.CancellationSource;
import com.skillq.skill.ProgressUpdate;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillContext;
import com.skillq.skill.SkillResult;
import com.skillq.skill.ValidationIssue;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.Invoice;
import com.skillq.subject.Project;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WasteWiseAnalyticsSkillTest {

    private final WasteWiseAnalyticsSkill skill = new WasteWiseAnalyticsSkill(new CompactorOptimizationSkill());

    @Test
    void compactorPropertyGetsMonitorAndContaminationRecommendations() {
        Project project = SkillFixtures.project(200, EquipmentType.COMPACTOR);
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), "40", 200.0, 0.0))
                .haulLog(SkillFixtures.weeklyHauls(project.getId(), 4, "5.0"))
                .build();

        SkillResult<WasteWiseAnalyticsResult> result = skill.execute(context);

        assertTrue(result.success());
        WasteWiseAnalyticsResult data = result.data();
        assertFalse(data.leaseUpDetected());
        assertNotNull(data.compactorOptimization());
        assertEquals(1250.0, data.compactorOptimization().costPerHaul());
        assertEquals(List.of("compactor_monitors", "contamination_reduction"),
                data.recommendations().stream().map(WasteWiseAnalyticsResult.Recommendation::type).toList());

        WasteWiseAnalyticsResult.InvoiceMetrics metrics = data.invoiceMetrics();
        assertEquals(15_000.0, metrics.totalSpend());
        assertEquals(25.0, metrics.costPerDoor());
        assertEquals(2.9, metrics.yardsPerDoor());
        assertEquals(4.0, metrics.contaminationPercent());
        assertEquals(LocalDate.of(2024, 1, 31), metrics.periodStart());
        assertEquals(LocalDate.of(2024, 3, 31), metrics.periodEnd());

        WasteWiseAnalyticsResult.Summary summary = data.summary();
        assertEquals(23_550.0 + 3_600.0, summary.totalSavingsPotential());
        assertEquals(5_000.0, summary.currentMonthlyCost());
        assertEquals(3, summary.totalInvoices());
        assertEquals(4, summary.totalHauls());
    }

    @Test
    void bulkChargesAboveThresholdSuggestSubscription() {
        Project project = SkillFixtures.project(200, EquipmentType.DUMPSTER);
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), null, 0.0, 600.0))
                .build();

        WasteWiseAnalyticsResult data = skill.execute(context).data();

        assertNull(data.compactorOptimization());
        assertEquals(2.2, data.invoiceMetrics().yardsPerDoor());
        assertEquals(1, data.recommendations().size());
        WasteWiseAnalyticsResult.Recommendation bulk = data.recommendations().get(0);
        assertEquals("bulk_subscription", bulk.type());
        assertEquals(1800.0 * 0.3 * 12, bulk.annualSavings(), 1e-9);
    }

    @Test
    void leaseUpSuppressesRecommendations() {
        Project project = SkillFixtures.project(500, EquipmentType.COMPACTOR);
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), "10", 400.0, 900.0))
                .haulLog(SkillFixtures.weeklyHauls(project.getId(), 4, "2.0"))
                .build();

        WasteWiseAnalyticsResult data = skill.execute(context).data();

        assertTrue(data.leaseUpDetected());
        assertTrue(data.compactorOptimization().recommend());
        assertTrue(data.recommendations().isEmpty());
        assertEquals(0.0, data.summary().totalSavingsPotential());
    }

    @Test
    void leaseUpBoundary() {
        SkillConfig config = SkillConfig.canonical();

        assertFalse(WasteWiseAnalyticsSkill.isLeaseUp(2.2, config));
        assertFalse(WasteWiseAnalyticsSkill.isLeaseUp(1.4, config));
        assertTrue(WasteWiseAnalyticsSkill.isLeaseUp(1.3, config));
    }

    @Test
    void compactorSubStepProgressStaysOffTheJob() {
        Project project = SkillFixtures.project(200, EquipmentType.COMPACTOR);
        List<Integer> percents = new ArrayList<>();
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), "40", 0.0, 0.0))
                .haulLog(SkillFixtures.weeklyHauls(project.getId(), 4, "5.0"))
                .progressListener(update -> percents.add(update.percent()))
                .build();

        skill.execute(context);

        assertEquals(List.of(0, 5, 20, 35, 40, 50, 90, 100), percents);
    }

    @Test
    void stepsReportPositionOutOfFour() {
        Project project = SkillFixtures.project(200, EquipmentType.DUMPSTER);
        List<ProgressUpdate> updates = new ArrayList<>();
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), null, 0.0, 0.0))
                .progressListener(updates::add)
                .build();

        skill.execute(context);

        ProgressUpdate last = updates.get(updates.size() - 2);
        assertEquals("Assembling final results", last.step());
        assertEquals(4, last.stepNumber());
        assertEquals(4, last.totalSteps());
    }

    @Test
    void cancelledAnalysisStopsAtNextCheckpoint() {
        Project project = SkillFixtures.project(200, EquipmentType.DUMPSTER);
        CancellationSource source = new CancellationSource();
        SkillContext context = SkillFixtures.context(project)
                .invoices(quarter(project.getId(), null, 0.0, 0.0))
                .cancellationToken(source)
                .progressListener(update -> {
                    if (update.percent() == 20) {
                        source.cancel();
                    }
                })
                .build();

        SkillResult<WasteWiseAnalyticsResult> result = skill.execute(context);

        assertTrue(result.isCancelled());
    }

    @Test
    void smallPropertyWithoutInvoicesFailsValidation() {
        Project project = SkillFixtures.project(8, EquipmentType.DUMPSTER);

        List<String> codes = skill.validate(SkillFixtures.context(project).build()).errors().stream()
                .map(ValidationIssue::code).toList();

        assertEquals(List.of("MISSING_INVOICES", "INVALID_UNIT_COUNT"), codes);
    }

    private static List<Invoice> quarter(UUID projectId, String tons, double contamination, double bulk) {
        return List.of(
                SkillFixtures.invoice(projectId, LocalDate.of(2024, 1, 31), "5000.00", tons, 4, contamination, bulk),
                SkillFixtures.invoice(projectId, LocalDate.of(2024, 2, 29), "5000.00", tons, 4, contamination, bulk),
                SkillFixtures.invoice(projectId, LocalDate.of(2024, 3, 31), "5000.00", tons, 4, contamination, bulk));
    }
}
