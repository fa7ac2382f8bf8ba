package com.skillq.skill.impl;

import com.skillq.skill.ResourceUsage;
import com.skillq.spi.ResearchProvider;

import java.time.LocalDate;
import java.util.List;

public record RegulatoryResearchResult(
        String city,
        String state,
        List<ResearchProvider.Ordinance> ordinances,
        List<ResearchProvider.Requirement> requirements,
        ComplianceStatus complianceStatus,
        List<ComplianceIssue> issues,
        List<String> recommendations,
        Confidence confidence,
        LocalDate researchDate,
        LocalDate expirationDate,
        ResourceUsage aiUsage) {

    public RegulatoryResearchResult {
        ordinances = List.copyOf(ordinances);
        requirements = List.copyOf(requirements);
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public enum ComplianceStatus {
        COMPLIANT,
        NON_COMPLIANT,
        UNKNOWN
    }

    public enum Confidence {
        HIGH,
        MEDIUM,
        LOW
    }

    public record ComplianceIssue(String severity, String issue, String requirement, String recommendation) {
    }
}
