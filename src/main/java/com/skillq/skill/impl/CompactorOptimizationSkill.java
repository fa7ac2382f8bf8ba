package com.skillq.skill.impl;

import com.skillq.error.InsufficientDataException;
import com.skillq.skill.AbstractSkill;
import com.skillq.skill.FormulaConstants;
import com.skillq.skill.SkillConfig;
import com.skillq.skill.SkillContext;
import com.skillq.skill.ValidationIssue;
import com.skillq.subject.EquipmentType;
import com.skillq.subject.HaulRecord;
import com.skillq.subject.Invoice;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Decides whether a fullness monitor pays off for a compactor that is hauled before it is full,
 * and projects the savings of hauling at target capacity instead.
 */
@Component
public class CompactorOptimizationSkill extends AbstractSkill<CompactorOptimizationResult> {

    public static final String NAME = "compactor-optimization";

    static final int MIN_HAUL_RECORDS = 3;

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
        return "Recommends compactor monitors when average tons per haul is below the optimization threshold";
    }

    @Override
    protected void validateInput(SkillContext context, List<ValidationIssue> errors) {
        List<HaulRecord> haulLog = context.haulLog();
        if (haulLog.isEmpty()) {
            errors.add(new ValidationIssue("haulLog",
                    "No haul log data found. Compactor optimization requires haul records.", "MISSING_HAUL_LOG"));
        } else if (haulLog.size() < MIN_HAUL_RECORDS) {
            errors.add(new ValidationIssue("haulLog", "Insufficient haul log data. Need at least "
                    + MIN_HAUL_RECORDS + " records, found " + haulLog.size() + ".", "INSUFFICIENT_HAUL_LOG"));
        }
        EquipmentType equipment = context.project().getEquipmentType();
        if (equipment != EquipmentType.COMPACTOR) {
            errors.add(new ValidationIssue("equipmentType",
                    "Equipment type must be COMPACTOR, found " + equipment, "INVALID_EQUIPMENT_TYPE"));
        }
    }

    @Override
    protected CompactorOptimizationResult executeInternal(SkillContext context) {
        validateFormulas(context);

        List<HaulRecord> haulLog = context.haulLog();
        if (haulLog.isEmpty()) {
            throw new InsufficientDataException(NAME, List.of("haulLog"));
        }
        SkillConfig config = context.config();
        double threshold = config.thresholds().compactorTons();
        double targetTons = config.conversionRates().targetCapacity();

        context.reportProgress(10, "Analyzing haul log data");
        int totalHauls = haulLog.size();
        double totalTons = 0.0;
        for (HaulRecord haul : haulLog) {
            totalTons += toDouble(haul.getTonnage());
        }
        double avgTonsPerHaul = totalTons / totalHauls;
        double utilization = round2(avgTonsPerHaul / targetTons * 100.0);
        context.checkCancellation();

        context.reportProgress(30, "Calculating pickup intervals");
        int maxDaysBetween = 0;
        for (int i = 1; i < haulLog.size(); i++) {
            long days = ChronoUnit.DAYS.between(haulLog.get(i - 1).getHaulDate(), haulLog.get(i).getHaulDate());
            maxDaysBetween = (int) Math.max(maxDaysBetween, days);
        }
        context.checkCancellation();

        context.reportProgress(50, "Checking optimization criteria");
        boolean recommend = avgTonsPerHaul < threshold;
        log.debug("Compactor on project {}: avg {} tons/haul against threshold {}, max {} days between pickups",
                context.subjectId(), avgTonsPerHaul, threshold, maxDaysBetween);
        context.checkCancellation();

        context.reportProgress(70, "Calculating ROI");
        if (!recommend) {
            return CompactorOptimizationResult.notRecommended(round2(avgTonsPerHaul), targetTons, utilization,
                    totalHauls, maxDaysBetween);
        }

        int currentAnnualHauls = annualHauls(haulLog);
        double annualTons = avgTonsPerHaul * currentAnnualHauls;
        int optimizedAnnualHauls = (int) Math.round(annualTons / targetTons);
        int haulsEliminated = Math.max(0, currentAnnualHauls - optimizedAnnualHauls);
        double costPerHaul = costPerHaul(context.invoices());

        double monitorAnnualCost = FormulaConstants.DSQ_MONITOR_MONTHLY * FormulaConstants.MONTHS_PER_YEAR;
        double firstYearCost = FormulaConstants.DSQ_MONITOR_INSTALL + monitorAnnualCost;
        double gross = haulsEliminated * costPerHaul;
        double netYear1 = gross - FormulaConstants.DSQ_MONITOR_INSTALL - monitorAnnualCost;
        double netYear2Plus = gross - monitorAnnualCost;
        double roiPercent = netYear1 / firstYearCost * 100.0;
        double paybackMonths = gross > 0 ? firstYearCost / (gross / FormulaConstants.MONTHS_PER_YEAR) : 0.0;

        return new CompactorOptimizationResult(true, round2(avgTonsPerHaul), targetTons, utilization, totalHauls,
                currentAnnualHauls, optimizedAnnualHauls, haulsEliminated, round2(costPerHaul), round2(gross),
                round2(netYear1), round2(netYear2Plus), round2(roiPercent), round2(paybackMonths), maxDaysBetween);
    }

    /**
     * Hauls per year at the cadence observed in the log. A log spanning a single day counts as daily service.
     */
    static int annualHauls(List<HaulRecord> haulLog) {
        LocalDate first = haulLog.get(0).getHaulDate();
        LocalDate last = haulLog.get(haulLog.size() - 1).getHaulDate();
        long spanDays = ChronoUnit.DAYS.between(first, last);
        if (spanDays <= 0) {
            return 365;
        }
        int intervals = haulLog.size() - 1;
        return (int) Math.round(intervals * 365.0 / spanDays);
    }

    static double costPerHaul(List<Invoice> invoices) {
        double totalCost = 0.0;
        int totalHauls = 0;
        for (Invoice invoice : invoices) {
            Integer hauls = invoice.getHauls();
            if (hauls != null && hauls > 0) {
                totalCost += toDouble(invoice.getTotalAmount());
                totalHauls += hauls;
            }
        }
        return totalHauls > 0 ? totalCost / totalHauls : FormulaConstants.DEFAULT_COST_PER_HAUL;
    }

    private static double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
