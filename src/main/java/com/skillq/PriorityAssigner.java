package com.skillq;

/**
 * Computes the queue priority of a new job. Lower numbers are claimed first.
 */
public final class PriorityAssigner {

    public static final int EXPEDITED = 3;
    public static final int NORMAL = 5;
    public static final int LOW = 7;

    private PriorityAssigner() {
    }

    public static PriorityDecision assign(JobType type, long completedAnalysesForActor) {
        return switch (type) {
            case COMPLETE_ANALYSIS -> completedAnalysesForActor == 0
                    ? new PriorityDecision(EXPEDITED, "First analysis for actor")
                    : new PriorityDecision(NORMAL, "Standard analysis");
            case INVOICE_EXTRACTION -> new PriorityDecision(NORMAL, "Invoice extraction");
            case REGULATORY_RESEARCH -> new PriorityDecision(NORMAL, "Regulatory research");
            case REPORT_GENERATION -> new PriorityDecision(LOW, "Report generation");
        };
    }

    public record PriorityDecision(int priority, String reason) {
    }
}
