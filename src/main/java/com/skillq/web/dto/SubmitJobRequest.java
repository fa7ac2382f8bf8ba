package com.skillq.web.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

public record SubmitJobRequest(UUID subjectId, UUID actorId, String jobType, JsonNode payload) {
}
