package com.skillq.error;

import java.util.Map;

public class CancelledException extends SkillQException {

    public static final String CODE = "CANCELLED";

    public CancelledException(String message) {
        super(message, CODE, 409, false, Map.of());
    }
}
