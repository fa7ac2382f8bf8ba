package com.skillq.error;

import java.util.Map;

public class InvalidStateException extends SkillQException {

    public static final String CODE = "INVALID_STATE";

    public InvalidStateException(String message, Map<String, Object> details) {
        super(message, CODE, 400, false, details);
    }
}
