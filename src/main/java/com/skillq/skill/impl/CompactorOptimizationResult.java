package com.skillq.skill.impl;

/**
 * Outcome of a compactor monitoring analysis. Savings fields are zero when no monitor is recommended.
 */
public record CompactorOptimizationResult(
        boolean recommend,
        double avgTonsPerHaul,
        double targetTonsPerHaul,
        double capacityUtilizationPercent,
        int totalHauls,
        int currentAnnualHauls,
        int optimizedAnnualHauls,
        int haulsEliminated,
        double costPerHaul,
        double grossAnnualSavings,
        double netYear1Savings,
        double netAnnualSavingsYear2Plus,
        double roiPercent,
        double paybackMonths,
        int maxDaysBetweenPickups) {

    static CompactorOptimizationResult notRecommended(double avgTonsPerHaul, double targetTonsPerHaul,
            double capacityUtilizationPercent, int totalHauls, int maxDaysBetweenPickups) {
        return new CompactorOptimizationResult(false, avgTonsPerHaul, targetTonsPerHaul, capacityUtilizationPercent,
                totalHauls, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, maxDaysBetweenPickups);
    }
}
