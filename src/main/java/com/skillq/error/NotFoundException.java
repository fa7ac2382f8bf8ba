package com.skillq.error;

import java.util.Map;

public class NotFoundException extends SkillQException {

    public static final String CODE = "NOT_FOUND";

    private final String resource;

    public NotFoundException(String resource, Object id) {
        super(resource + " '" + id + "' not found", CODE, 404, false,
                Map.of("resource", resource, "id", String.valueOf(id)));
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
