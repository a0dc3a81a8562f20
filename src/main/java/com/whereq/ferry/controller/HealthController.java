package com.whereq.ferry.controller;

import com.whereq.ferry.service.JobOrchestrator;
import com.whereq.ferry.service.JobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller reporting where jobs are sent.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    @Autowired
    private JobOrchestrator orchestrator;

    @Autowired
    private JobScheduler jobScheduler;

    @GetMapping
    @Operation(summary = "Health check", description = "Resolved project, location and source package")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", orchestrator.getSourcePackage() != null ? "UP" : "STARTING");
        health.put("service", "whereq-ferry");
        health.put("project", orchestrator.getProject());
        health.put("location", orchestrator.getLocation());
        health.put("runNamespace", orchestrator.getRunNamespace());
        if (orchestrator.getSourcePackage() != null) {
            health.put("sourcePackage", orchestrator.getSourcePackage().getBlobName());
        }
        health.put("activeJobs", jobScheduler.getActiveJobs().size());
        return Mono.just(ResponseEntity.ok(health));
    }
}
