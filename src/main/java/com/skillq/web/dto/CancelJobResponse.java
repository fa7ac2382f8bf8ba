package com.skillq.web.dto;

import com.skillq.JobStatus;

import java.util.UUID;

public record CancelJobResponse(UUID jobId, JobStatus status) {
}
