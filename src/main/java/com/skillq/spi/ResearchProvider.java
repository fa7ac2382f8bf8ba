package com.skillq.spi;

import com.skillq.skill.ResourceUsage;

import java.util.List;

/**
 * Looks up municipal waste ordinances for a location and the requirements they impose on multifamily
 * properties.
 */
@FunctionalInterface
public interface ResearchProvider {

    Findings research(String city, String state) throws Exception;

    record Ordinance(String title, String url, String jurisdiction, String summary) {
    }

    enum Category {
        WASTE,
        RECYCLING,
        COMPOSTING
    }

    record Requirement(Category category, String requirement, boolean mandatory, List<String> materials,
            String frequency, String source) {

        public Requirement {
            materials = materials == null ? List.of() : List.copyOf(materials);
        }
    }

    record Findings(List<Ordinance> ordinances, List<Requirement> requirements, ResourceUsage usage) {

        public Findings {
            ordinances = ordinances == null ? List.of() : List.copyOf(ordinances);
            requirements = requirements == null ? List.of() : List.copyOf(requirements);
            usage = usage == null ? ResourceUsage.NONE : usage;
        }
    }
}
