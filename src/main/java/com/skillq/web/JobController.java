package com.skillq.web;

import com.skillq.Job;
import com.skillq.JobClient;
import com.skillq.JobStatus;
import com.skillq.metrics.QueueMetrics;
import com.skillq.metrics.QueueMetricsService;
import com.skillq.web.dto.CancelJobResponse;
import com.skillq.web.dto.JobResponse;
import com.skillq.web.dto.SubmitJobRequest;
import com.skillq.web.dto.SubmitJobResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST API for the job lifecycle.
 *
 * POST   /api/jobs          enqueue a job
 * GET    /api/jobs/{id}     poll status, progress and result
 * DELETE /api/jobs/{id}     cancel a pending or processing job
 * GET    /api/jobs/metrics  queue statistics
 */
@RestController
@RequestMapping("/api/jobs")
@ConditionalOnProperty(prefix = "skillq.api", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobController {

    private final JobClient jobClient;
    private final QueueMetricsService queueMetricsService;

    public JobController(JobClient jobClient, QueueMetricsService queueMetricsService) {
        this.jobClient = jobClient;
        this.queueMetricsService = queueMetricsService;
    }

    @PostMapping
    public ResponseEntity<SubmitJobResponse> submit(@RequestBody SubmitJobRequest request) {
        Job job = jobClient.submit(request.jobType(), request.subjectId(), request.actorId(), request.payload());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmitJobResponse.from(job));
    }

    @GetMapping("/metrics")
    public QueueMetrics metrics() {
        return queueMetricsService.getQueueMetrics();
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return JobResponse.from(jobClient.getJob(id));
    }

    @DeleteMapping("/{id}")
    public CancelJobResponse cancel(@PathVariable UUID id) {
        jobClient.cancel(id);
        return new CancelJobResponse(id, JobStatus.CANCELLED);
    }
}
