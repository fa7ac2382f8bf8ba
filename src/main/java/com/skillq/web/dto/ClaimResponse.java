package com.skillq.web.dto;

import java.util.UUID;

public record ClaimResponse(UUID jobId) {
}
