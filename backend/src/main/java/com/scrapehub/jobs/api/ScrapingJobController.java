package com.scrapehub.jobs.api;

import com.scrapehub.jobs.model.ExecutionOutcome;
import com.scrapehub.jobs.model.ExecutionRecord;
import com.scrapehub.jobs.model.JobDefinition;
import com.scrapehub.jobs.model.JobUpsertRequest;
import com.scrapehub.jobs.model.LatestContentResponse;
import com.scrapehub.jobs.service.JobCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class ScrapingJobController {
    private final JobCatalogService catalogService;

    public ScrapingJobController(JobCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<JobDefinition> listJobs(@RequestParam(name = "userId", required = false) String userId) {
        return catalogService.listJobs(userId);
    }

    @GetMapping("/{id}")
    public JobDefinition getJob(@PathVariable("id") String id) {
        return catalogService.getJob(id);
    }

    @PostMapping
    public ResponseEntity<JobDefinition> createJob(@RequestBody(required = false) JobUpsertRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createJob(request));
    }

    @PutMapping("/{id}")
    public JobDefinition updateJob(
        @PathVariable("id") String id,
        @RequestBody(required = false) JobUpsertRequest request
    ) {
        return catalogService.updateJob(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable("id") String id) {
        catalogService.deleteJob(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/history")
    public List<ExecutionRecord> history(
        @PathVariable("id") String id,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return catalogService.getHistory(id, limit);
    }

    @GetMapping("/{id}/latest")
    public LatestContentResponse latest(@PathVariable("id") String id) {
        return catalogService.getLatestContent(id);
    }

    @PostMapping("/{id}/run")
    public ExecutionOutcome runNow(@PathVariable("id") String id) {
        return catalogService.runJobNow(id);
    }
}
