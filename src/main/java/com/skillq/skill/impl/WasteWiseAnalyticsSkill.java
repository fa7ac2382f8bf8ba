package com.skillq.skill.impl;

import com.skillq.skill.AbstractSkill;
import com.skillq.skill.FormulaConstants;
import com.skillq.skill.ProgressUpdate;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillContext;
import com.skillq.skill.SkillResult;
import com.skillq.skill.ValidationIssue;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.Invoice;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Full property analysis. Runs the compactor analysis as a sub-step when the property has a compactor
 * with enough haul history; a failing sub-step is logged and the analysis continues without it.
 */
@Component
public class WasteWiseAnalyticsSkill extends AbstractSkill<WasteWiseAnalyticsResult> {

    public static final String NAME = "wastewise-analytics";

    static final int MIN_UNITS = 10;
    private static final int TOTAL_STEPS = 4;
    private static final double CONTAMINATION_REDUCTION_RATE = 0.5;
    private static final double BULK_SUBSCRIPTION_DISCOUNT = 0.3;

    private final CompactorOptimizationSkill compactorOptimization;

    public WasteWiseAnalyticsSkill(CompactorOptimizationSkill compactorOptimization) {
        this.compactorOptimization = compactorOptimization;
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
        return "Complete waste management analysis coordinating invoice metrics and optimization checks";
    }

    @Override
    protected void validateInput(SkillContext context, List<ValidationIssue> errors) {
        if (context.invoices().isEmpty()) {
            errors.add(new ValidationIssue("invoices",
                    "No invoice data found. At least one invoice is required for analysis.", "MISSING_INVOICES"));
        }
        if (context.project().getUnits() < MIN_UNITS) {
            errors.add(new ValidationIssue("units",
                    "Invalid unit count. Property must have at least " + MIN_UNITS + " units.", "INVALID_UNIT_COUNT"));
        }
    }

    @Override
    protected WasteWiseAnalyticsResult executeInternal(SkillContext context) {
        validateFormulas(context);
        SkillConfig config = context.config();

        step(context, 5, "Analyzing invoice data", 1);
        WasteWiseAnalyticsResult.InvoiceMetrics metrics = invoiceMetrics(context);

        step(context, 20, "Checking for lease-up conditions", 1);
        boolean leaseUp = isLeaseUp(metrics.yardsPerDoor(), config);
        if (leaseUp) {
            log.warn("Lease-up detected for project {}, optimization recommendations are suppressed",
                    context.subjectId());
        }
        context.checkCancellation();

        step(context, 35, "Running optimization analyses", 2);
        List<WasteWiseAnalyticsResult.Recommendation> recommendations = new ArrayList<>();
        ResourceUsage usage = ResourceUsage.NONE;
        CompactorOptimizationResult compactor = null;
        if (shouldRunCompactorOptimization(context)) {
            step(context, 40, "Analyzing compactor efficiency", 2);
            SkillResult<CompactorOptimizationResult> result = compactorOptimization.execute(subContext(context));
            if (result.success()) {
                compactor = result.data();
                if (compactor.recommend() && !leaseUp) {
                    recommendations.add(compactorRecommendation(compactor));
                }
                if (result.metadata().resourceUsage() != null) {
                    usage = usage.plus(result.metadata().resourceUsage());
                }
            } else if (result.isCancelled()) {
                context.checkCancellation();
            } else {
                log.warn("Compactor optimization failed for project {} with {}: {}", context.subjectId(),
                        result.error().code(), result.error().message());
            }
        }
        context.checkCancellation();

        step(context, 50, "Checking for additional optimization opportunities", 2);
        if (!leaseUp) {
            double contaminationThreshold = config.thresholds().contaminationPct();
            if (metrics.contaminationPercent() > contaminationThreshold) {
                recommendations.add(new WasteWiseAnalyticsResult.Recommendation(
                        "contamination_reduction", 2, "Implement Contamination Reduction Program",
                        String.format(Locale.ROOT,
                                "Contamination fees represent %.1f%% of total waste spend.",
                                metrics.contaminationPercent()),
                        round2(metrics.contaminationSpend() * CONTAMINATION_REDUCTION_RATE
                                * FormulaConstants.MONTHS_PER_YEAR),
                        "Resident education and container signage", "MEDIUM"));
            }
            if (metrics.avgBulkMonthly() > config.thresholds().bulkMonthly()) {
                recommendations.add(new WasteWiseAnalyticsResult.Recommendation(
                        "bulk_subscription", 3, "Switch to Bulk Subscription Service",
                        String.format(Locale.ROOT,
                                "Average bulk service charges of $%.2f/month exceed the subscription threshold.",
                                metrics.avgBulkMonthly()),
                        round2(metrics.bulkSpend() * BULK_SUBSCRIPTION_DISCOUNT * FormulaConstants.MONTHS_PER_YEAR),
                        "Negotiate subscription pricing with the current vendor", "MEDIUM"));
            }
        }
        context.checkCancellation();

        step(context, 90, "Assembling final results", 4);
        WasteWiseAnalyticsResult.Summary summary = summary(context, metrics, recommendations);
        log.info("Analysis of project {} found {} recommendations worth {} per year", context.subjectId(),
                recommendations.size(), summary.totalSavingsPotential());
        return new WasteWiseAnalyticsResult(summary, metrics, compactor, recommendations, leaseUp, usage);
    }

    @Override
    protected ResourceUsage resourceUsage(WasteWiseAnalyticsResult data) {
        return data.aiUsage();
    }

    WasteWiseAnalyticsResult.InvoiceMetrics invoiceMetrics(SkillContext context) {
        List<Invoice> invoices = context.invoices();
        int units = context.project().getUnits();
        double totalSpend = 0.0;
        double totalTons = 0.0;
        double contamination = 0.0;
        double bulk = 0.0;
        for (Invoice invoice : invoices) {
            totalSpend += toDouble(invoice.getTotalAmount());
            totalTons += toDouble(invoice.getTonnage());
            contamination += invoice.chargeOf("contamination");
            bulk += invoice.chargeOf("bulk_service");
        }
        int months = invoices.size();

        double yardsPerDoor;
        if (context.project().getEquipmentType() == EquipmentType.COMPACTOR) {
            yardsPerDoor = (totalTons / months) * context.config().conversionRates().compactorYpd() / units;
        } else {
            yardsPerDoor = FormulaConstants.BENCHMARK_YARDS_PER_DOOR;
        }

        LocalDate start = invoices.stream().map(Invoice::getInvoiceDate).filter(Objects::nonNull)
                .min(Comparator.naturalOrder()).orElse(null);
        LocalDate end = invoices.stream().map(Invoice::getInvoiceDate).filter(Objects::nonNull)
                .max(Comparator.naturalOrder()).orElse(null);
        double contaminationPercent = totalSpend > 0 ? contamination / totalSpend * 100.0 : 0.0;

        return new WasteWiseAnalyticsResult.InvoiceMetrics(round2(totalSpend), start, end,
                round2(totalSpend / months / units), round2(yardsPerDoor), round2(contamination),
                round2(contaminationPercent), round2(bulk), round2(bulk / months));
    }

    /**
     * Occupancy is still ramping when yards per door sits far enough below the benchmark.
     */
    static boolean isLeaseUp(double yardsPerDoor, SkillConfig config) {
        double benchmark = FormulaConstants.BENCHMARK_YARDS_PER_DOOR;
        double variance = (yardsPerDoor - benchmark) / benchmark * 100.0;
        return variance < config.thresholds().leaseupVariance();
    }

    private boolean shouldRunCompactorOptimization(SkillContext context) {
        return context.project().getEquipmentType() == EquipmentType.COMPACTOR
                && context.haulLog().size() >= CompactorOptimizationSkill.MIN_HAUL_RECORDS;
    }

    /**
     * The sub-step reports its own 0..100 progress; keep it off the job row.
     */
    private SkillContext subContext(SkillContext context) {
        return context.toBuilder().progressListener(null).build();
    }

    private WasteWiseAnalyticsResult.Recommendation compactorRecommendation(CompactorOptimizationResult result) {
        return new WasteWiseAnalyticsResult.Recommendation(
                "compactor_monitors", 1, "Install DSQ Waste Monitoring System",
                String.format(Locale.ROOT,
                        "Reduce pickups by optimizing compactor fill levels. Current average: %.2f tons/haul. "
                                + "Target: %.1f tons/haul.",
                        result.avgTonsPerHaul(), result.targetTonsPerHaul()),
                result.netYear1Savings(),
                String.format(Locale.ROOT, "%.1f month payback period", result.paybackMonths()),
                "HIGH");
    }

    private WasteWiseAnalyticsResult.Summary summary(SkillContext context,
            WasteWiseAnalyticsResult.InvoiceMetrics metrics,
            List<WasteWiseAnalyticsResult.Recommendation> recommendations) {
        double totalSavings = 0.0;
        for (WasteWiseAnalyticsResult.Recommendation recommendation : recommendations) {
            totalSavings += recommendation.annualSavings();
        }
        double currentMonthly = metrics.totalSpend() / context.invoices().size();
        double optimizedMonthly = currentMonthly - totalSavings / FormulaConstants.MONTHS_PER_YEAR;
        double savingsPercentage = currentMonthly > 0
                ? totalSavings / (currentMonthly * FormulaConstants.MONTHS_PER_YEAR) * 100.0
                : 0.0;
        return new WasteWiseAnalyticsResult.Summary(round2(totalSavings), round2(currentMonthly),
                round2(optimizedMonthly), round2(savingsPercentage), metrics.periodStart(), metrics.periodEnd(),
                context.invoices().size(), context.haulLog().size());
    }

    private static void step(SkillContext context, int percent, String step, int stepNumber) {
        context.reportProgress(new ProgressUpdate(percent, step, stepNumber, TOTAL_STEPS));
    }

    private static double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
