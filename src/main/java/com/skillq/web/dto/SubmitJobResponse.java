package com.skillq.web.dto;

import com.skillq.Job;
import com.skillq.JobStatus;

import java.util.UUID;

public record SubmitJobResponse(UUID jobId, JobStatus status, int priority, String message) {

    public static SubmitJobResponse from(Job job) {
        String message = job.getPriorityReason() != null
                ? "Job queued (" + job.getPriorityReason() + ")"
                : "Job queued";
        return new SubmitJobResponse(job.getId(), job.getStatus(), job.getPriority(), message);
    }
}
