package com.skillq.skill.impl;

import com.skillq.skill.ResourceUsage;

import java.time.LocalDate;
import java.util.List;

/**
 * Complete property analysis: invoice metrics, optional compactor analysis and the ranked recommendations.
 */
public record WasteWiseAnalyticsResult(
        Summary summary,
        InvoiceMetrics invoiceMetrics,
        CompactorOptimizationResult compactorOptimization,
        List<Recommendation> recommendations,
        boolean leaseUpDetected,
        ResourceUsage aiUsage) {

    public WasteWiseAnalyticsResult {
        recommendations = List.copyOf(recommendations);
    }

    public record Summary(
            double totalSavingsPotential,
            double currentMonthlyCost,
            double optimizedMonthlyCost,
            double savingsPercentage,
            LocalDate periodStart,
            LocalDate periodEnd,
            int totalInvoices,
            int totalHauls) {
    }

    /**
     * Figures are averaged per invoice, which is one billing month.
     */
    public record InvoiceMetrics(
            double totalSpend,
            LocalDate periodStart,
            LocalDate periodEnd,
            double costPerDoor,
            double yardsPerDoor,
            double contaminationSpend,
            double contaminationPercent,
            double bulkSpend,
            double avgBulkMonthly) {
    }

    public record Recommendation(
            String type,
            int priority,
            String title,
            String description,
            double annualSavings,
            String implementation,
            String confidence) {
    }
}
