package com.skillq.web;

import com.skillq.JobStore;
import com.skillq.error.ValidationException;
import com.skillq.web.dto.ClaimRequest;
import com.skillq.web.dto.ClaimResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Claim endpoint for workers running outside this process. 204 when nothing is eligible.
 */
@RestController
@RequestMapping("/api/worker")
@ConditionalOnProperty(prefix = "skillq.api", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerController {

    private final JobStore jobStore;

    public WorkerController(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @PostMapping("/claim")
    public ResponseEntity<ClaimResponse> claim(@RequestBody ClaimRequest request) {
        if (request.workerId() == null || request.workerId().isBlank()) {
            throw new ValidationException("workerId is required", "workerId");
        }
        if (request.workerId().trim().length() > JobStore.MAX_WORKER_ID_LENGTH) {
            throw new ValidationException("workerId must not exceed " + JobStore.MAX_WORKER_ID_LENGTH
                    + " characters", "workerId");
        }
        return jobStore.claimNext(request.workerId().trim())
                .map(job -> ResponseEntity.ok(new ClaimResponse(job.getId())))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
