package com.skillq.error;

import java.util.List;
import java.util.Map;

public class InvalidJobTypeException extends SkillQException {

    public static final String CODE = "INVALID_JOB_TYPE";

    public InvalidJobTypeException(String jobType, List<String> supported) {
        super("Unsupported job type '" + jobType + "'", CODE, 400, false,
                Map.of("jobType", String.valueOf(jobType), "supported", supported));
    }
}
