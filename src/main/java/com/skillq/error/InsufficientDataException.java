package com.skillq.error;

import java.util.List;
import java.util.Map;

public class InsufficientDataException extends SkillQException {

    public static final String CODE = "INSUFFICIENT_DATA";

    public InsufficientDataException(String skillName, List<String> missingFields) {
        super("Insufficient data for " + skillName + ": missing " + String.join(", ", missingFields),
                CODE, 400, false, Map.of("skill", skillName, "missingFields", List.copyOf(missingFields)));
    }
}
