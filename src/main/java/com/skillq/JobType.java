package com.skillq;

import com.fasterxml.jackson.annotation.JsonValue;
import com.skillq.error.InvalidJobTypeException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of work the pipeline accepts. Wire names are the lowercase API values.
 */
public enum JobType {
    COMPLETE_ANALYSIS("complete_analysis"),
    INVOICE_EXTRACTION("invoice_extraction"),
    REGULATORY_RESEARCH("regulatory_research"),
    REPORT_GENERATION("report_generation");

    private final String wireName;

    JobType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static JobType fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidJobTypeException(value, wireNames());
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (JobType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new InvalidJobTypeException(value, wireNames());
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(JobType::wireName).toList();
    }
}
