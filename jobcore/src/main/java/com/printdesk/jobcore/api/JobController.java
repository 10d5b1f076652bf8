package com.printdesk.jobcore.api;

import com.printdesk.jobcore.api.dto.ComponentResponse;
import com.printdesk.jobcore.api.dto.CreateJobRequest;
import com.printdesk.jobcore.api.dto.EffectiveStateResponse;
import com.printdesk.jobcore.api.dto.JobResponse;
import com.printdesk.jobcore.changeorder.ChangeOrderService;
import com.printdesk.jobcore.model.Job;
import com.printdesk.jobcore.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for jobs.
 *
 * POST /jobs                       create a job (allocates its baseJobId, seeds components)
 * GET  /jobs/{id}                  current state of a job
 * POST /jobs/{id}/activate         validate components and leave DRAFT
 * GET  /jobs/{id}/components       components in sortOrder
 * GET  /jobs/{id}/effective-state  base specs with approved change orders applied
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    private final JobService         jobService;
    private final ChangeOrderService changeOrderService;

    public JobController(JobService jobService, ChangeOrderService changeOrderService) {
        this.jobService         = jobService;
        this.changeOrderService = changeOrderService;
    }

    /**
     * Create a job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" \
     *     -d '{"title":"Spring catalog","jobMetaType":"JOB","jobType":"BOOKLET_PLUS_COVER"}'
     */
    @PostMapping
    public ResponseEntity<JobResponse> create(@RequestBody CreateJobRequest req) {
        Job job = jobService.createJob(req.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobResponse.from(job));
    }

    /**
     * Returns 404 if the job ID is not found.
     */
    @GetMapping("/{id}")
    public JobResponse getJob(@PathVariable UUID id) {
        return jobService.findById(id)
                .map(JobResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Job not found: " + id));
    }

    /**
     * HTTP 200 with the ACTIVE job, 422 with the validation issues if the
     * components are incomplete, 409 if the job already left DRAFT.
     */
    @PostMapping("/{id}/activate")
    public JobResponse activate(@PathVariable UUID id) {
        return JobResponse.from(jobService.activate(id));
    }

    @GetMapping("/{id}/components")
    public List<ComponentResponse> getComponents(@PathVariable UUID id) {
        jobService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + id));
        return jobService.getComponents(id).stream()
                .map(ComponentResponse::from)
                .toList();
    }

    @GetMapping("/{id}/effective-state")
    public EffectiveStateResponse getEffectiveState(@PathVariable UUID id) {
        return EffectiveStateResponse.from(changeOrderService.effectiveState(id));
    }
}
