package org.iceforge.governor.api;

import org.iceforge.governor.quota.QuotaDecision;
import org.iceforge.governor.quota.QuotaExceededException;
import org.iceforge.governor.registry.ArtifactRecord;
import org.iceforge.governor.registry.JobAdmission;
import org.iceforge.governor.registry.JobRecord;
import org.iceforge.governor.registry.JobRegistry;
import org.iceforge.governor.registry.JobStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobAdmission admission;
    private final JobRegistry jobs;
    private final Clock clock;

    public JobController(JobAdmission admission, JobRegistry jobs, Clock clock) {
        this.admission = Objects.requireNonNull(admission);
        this.jobs = Objects.requireNonNull(jobs);
        this.clock = Objects.requireNonNull(clock);
    }

    public record ArtifactSpec(String artifactId, long sizeBytes) {}

    public record JobSubmission(String jobId, String tenantId, String status, List<ArtifactSpec> artifacts) {}

    public record StatusUpdate(String status) {}

    /**
     * Admits a job and its artifacts against the tenant's job and artifact quotas.
     */
    @PostMapping
    public ResponseEntity<JobRecord> submit(@RequestBody JobSubmission req) {
        if (req == null || req.tenantId() == null || req.tenantId().isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        Instant now = clock.instant();
        String jobId = req.jobId() == null || req.jobId().isBlank() ? UUID.randomUUID().toString() : req.jobId();
        List<ArtifactRecord> outputs = new ArrayList<>();
        if (req.artifacts() != null) {
            for (ArtifactSpec a : req.artifacts()) {
                String id = a.artifactId() == null || a.artifactId().isBlank() ? UUID.randomUUID().toString() : a.artifactId();
                outputs.add(new ArtifactRecord(id, req.tenantId(), jobId, now, a.sizeBytes()));
            }
        }
        JobRecord job = new JobRecord(jobId, req.tenantId(), now, parseStatus(req.status(), JobStatus.QUEUED), List.of());

        QuotaDecision decision = admission.submit(job, outputs);
        if (!decision.allowed()) {
            throw new QuotaExceededException(decision);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(jobs.find(jobId).orElse(job));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobRecord> get(@PathVariable("jobId") String jobId) {
        return jobs.find(jobId).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PutMapping("/{jobId}/status")
    public ResponseEntity<JobRecord> updateStatus(@PathVariable("jobId") String jobId, @RequestBody StatusUpdate req) {
        JobRecord job = jobs.find(jobId).orElse(null);
        if (job == null) return ResponseEntity.notFound().build();
        JobRecord updated = job.withStatus(parseStatus(req == null ? null : req.status(), null));
        jobs.register(updated);
        return ResponseEntity.ok(updated);
    }

    private static JobStatus parseStatus(String s, JobStatus fallback) {
        if (s == null || s.isBlank()) {
            if (fallback != null) return fallback;
            throw new IllegalArgumentException("status is required");
        }
        try {
            return JobStatus.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job status: " + s);
        }
    }
}
