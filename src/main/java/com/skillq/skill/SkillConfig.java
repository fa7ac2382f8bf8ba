package com.skillq.skill;

/**
 * Formula inputs a skill runs with, loaded from the skill configuration table.
 */
public record SkillConfig(ConversionRates conversionRates, Thresholds thresholds) {

    public static SkillConfig canonical() {
        return new SkillConfig(
                new ConversionRates(FormulaConstants.TONS_TO_YARDS, FormulaConstants.WEEKS_PER_MONTH,
                        FormulaConstants.COMPACTOR_TARGET_TONS),
                new Thresholds(FormulaConstants.COMPACTOR_OPTIMIZATION_THRESHOLD,
                        FormulaConstants.CONTAMINATION_THRESHOLD_PCT * 100,
                        FormulaConstants.BULK_SUBSCRIPTION_THRESHOLD,
                        FormulaConstants.LEASEUP_VARIANCE_THRESHOLD));
    }

    public record ConversionRates(double compactorYpd, double dumpsterYpd, double targetCapacity) {
    }

    /**
     * {@code contaminationPct} is a percentage (3.0 means 3%).
     */
    public record Thresholds(double compactorTons, double contaminationPct, double bulkMonthly,
            double leaseupVariance) {
    }
}
