package com.calcron.infrastructure.web;

import com.calcron.application.FindJobs;
import com.calcron.infrastructure.web.dto.JobListResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/jobs")
public class JobController {

    private static final Logger logger = LoggerFactory.getLogger(JobController.class);

    private final FindJobs findJobs;

    public JobController(FindJobs findJobs) {
        this.findJobs = findJobs;
    }

    @GetMapping
    public ResponseEntity<JobListResponse> listJobs() {
        var records = findJobs.execute();
        logger.info("Listing {} tracked jobs", records.size());
        return ResponseEntity.ok(JobListResponse.fromRecords(records));
    }
}
