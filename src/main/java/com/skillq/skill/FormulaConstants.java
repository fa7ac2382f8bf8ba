package com.skillq.skill;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical waste formula constants. Persisted skill configuration must match these exactly.
 */
public final class FormulaConstants {

    public static final double TONS_TO_YARDS = 14.49;
    public static final double WEEKS_PER_MONTH = 4.33;
    public static final double COMPACTOR_OPTIMIZATION_THRESHOLD = 6.0;
    public static final double COMPACTOR_TARGET_TONS = 8.5;
    public static final double DSQ_MONITOR_INSTALL = 300.0;
    public static final double DSQ_MONITOR_MONTHLY = 200.0;
    public static final int MONTHS_PER_YEAR = 12;
    public static final double CONTAMINATION_THRESHOLD_PCT = 0.03;
    public static final double BULK_SUBSCRIPTION_THRESHOLD = 500.0;
    public static final double LEASEUP_VARIANCE_THRESHOLD = -40.0;
    public static final double BENCHMARK_YARDS_PER_DOOR = 2.2;
    public static final double DEFAULT_COST_PER_HAUL = 850.0;

    private static final double TOLERANCE = 1e-9;

    private FormulaConstants() {
    }

    /**
     * Returns every config value that differs from its canonical constant, keyed by config path.
     * Empty when the config is consistent.
     */
    public static Map<String, Object> mismatches(SkillConfig config) {
        Map<String, Object> mismatches = new LinkedHashMap<>();
        SkillConfig canonical = SkillConfig.canonical();
        SkillConfig.ConversionRates rates = config.conversionRates();
        SkillConfig.Thresholds thresholds = config.thresholds();

        compare(mismatches, "conversionRates.compactorYpd", rates.compactorYpd(),
                canonical.conversionRates().compactorYpd());
        compare(mismatches, "conversionRates.dumpsterYpd", rates.dumpsterYpd(),
                canonical.conversionRates().dumpsterYpd());
        compare(mismatches, "conversionRates.targetCapacity", rates.targetCapacity(),
                canonical.conversionRates().targetCapacity());
        compare(mismatches, "thresholds.compactorTons", thresholds.compactorTons(),
                canonical.thresholds().compactorTons());
        compare(mismatches, "thresholds.contaminationPct", thresholds.contaminationPct(),
                canonical.thresholds().contaminationPct());
        compare(mismatches, "thresholds.bulkMonthly", thresholds.bulkMonthly(),
                canonical.thresholds().bulkMonthly());
        compare(mismatches, "thresholds.leaseupVariance", thresholds.leaseupVariance(),
                canonical.thresholds().leaseupVariance());
        return mismatches;
    }

    private static void compare(Map<String, Object> mismatches, String key, double actual, double expected) {
        if (Double.isNaN(actual) || Math.abs(actual - expected) > TOLERANCE) {
            mismatches.put(key, Map.of("expected", expected, "actual", actual));
        }
    }
}
