package com.skillq.skill.impl;

import com.skillq.skill.AbstractSkill;
import com.skillq.skill.ResourceUsage;
import com.skillq.skill.SkillContext;
import com.skillq.skill.ValidationIssue;
import com.skillq.spi.ResearchProvider;
import com.skillq.subject.Project;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Researches the ordinances that apply to a property's city and flags the mandatory requirements
 * for review. Findings go stale after {@value #VALIDITY_DAYS} days.
 */
public class RegulatoryResearchSkill extends AbstractSkill<RegulatoryResearchResult> {

    public static final String NAME = "regulatory-research";

    static final int VALIDITY_DAYS = 90;

    private final ResearchProvider researchProvider;

    public RegulatoryResearchSkill(ResearchProvider researchProvider) {
        this.researchProvider = researchProvider;
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
        return "Researches municipal ordinances and assesses waste management compliance for a property location";
    }

    @Override
    protected void validateInput(SkillContext context, List<ValidationIssue> errors) {
        Project project = context.project();
        if (isBlank(project.getCity())) {
            errors.add(new ValidationIssue("city", "City is required for regulatory research", "MISSING_CITY"));
        }
        if (isBlank(project.getState())) {
            errors.add(new ValidationIssue("state", "State is required for regulatory research", "MISSING_STATE"));
        }
    }

    @Override
    protected RegulatoryResearchResult executeInternal(SkillContext context) throws Exception {
        Project project = context.project();
        String city = project.getCity().trim();
        String state = project.getState().trim();

        context.reportProgress(10, "Searching for ordinances in " + city + ", " + state);
        ResearchProvider.Findings findings = researchProvider.research(city, state);
        log.info("Found {} ordinances and {} requirements for {}, {}", findings.ordinances().size(),
                findings.requirements().size(), city, state);
        context.checkCancellation();

        context.reportProgress(70, "Assessing compliance");
        List<RegulatoryResearchResult.ComplianceIssue> issues = new ArrayList<>();
        for (ResearchProvider.Requirement requirement : findings.requirements()) {
            if (requirement.mandatory()) {
                issues.add(issueFor(requirement));
            }
        }
        List<String> recommendations = new ArrayList<>();
        if (!issues.isEmpty()) {
            issues.forEach(issue -> recommendations.add(issue.recommendation()));
            recommendations.add("Review ordinances and update service agreement to ensure full compliance");
            recommendations.add("Contact local waste management authority for guidance on compliance requirements");
        }
        RegulatoryResearchResult.ComplianceStatus status = issues.isEmpty()
                ? RegulatoryResearchResult.ComplianceStatus.COMPLIANT
                : RegulatoryResearchResult.ComplianceStatus.UNKNOWN;
        context.checkCancellation();

        context.reportProgress(90, "Calculating confidence");
        LocalDate today = LocalDate.now();
        return new RegulatoryResearchResult(city, state, findings.ordinances(), findings.requirements(), status,
                issues, recommendations, confidence(findings), today, today.plusDays(VALIDITY_DAYS),
                findings.usage());
    }

    @Override
    protected ResourceUsage resourceUsage(RegulatoryResearchResult data) {
        return data.aiUsage();
    }

    /**
     * HIGH with 3+ ordinances and 5+ waste or recycling requirements, MEDIUM with at least one ordinance
     * and one waste requirement, LOW otherwise.
     */
    static RegulatoryResearchResult.Confidence confidence(ResearchProvider.Findings findings) {
        int ordinances = findings.ordinances().size();
        long waste = count(findings, ResearchProvider.Category.WASTE);
        long recycling = count(findings, ResearchProvider.Category.RECYCLING);
        if (ordinances >= 3 && waste + recycling >= 5) {
            return RegulatoryResearchResult.Confidence.HIGH;
        }
        if (ordinances >= 1 && waste >= 1) {
            return RegulatoryResearchResult.Confidence.MEDIUM;
        }
        return RegulatoryResearchResult.Confidence.LOW;
    }

    private static long count(ResearchProvider.Findings findings, ResearchProvider.Category category) {
        return findings.requirements().stream().filter(r -> r.category() == category).count();
    }

    private static RegulatoryResearchResult.ComplianceIssue issueFor(ResearchProvider.Requirement requirement) {
        return switch (requirement.category()) {
            case WASTE -> new RegulatoryResearchResult.ComplianceIssue("MEDIUM", "Mandatory waste requirement",
                    requirement.requirement(), "Verify current service meets requirement: " + requirement.requirement());
            case RECYCLING -> new RegulatoryResearchResult.ComplianceIssue("MEDIUM", "Mandatory recycling requirement",
                    requirement.requirement(),
                    "Ensure recycling service covers: " + String.join(", ", requirement.materials()));
            case COMPOSTING -> new RegulatoryResearchResult.ComplianceIssue("LOW", "Composting requirement exists",
                    requirement.requirement(),
                    "Consider composting service for: " + String.join(", ", requirement.materials()));
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
