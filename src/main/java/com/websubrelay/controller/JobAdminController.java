package com.websubrelay.controller;

import com.websubrelay.model.JobRecord;
import com.websubrelay.repository.JobLedgerRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Inspection of permanently failed queue jobs")
public class JobAdminController {

    private static final int MAX_LIMIT = 500;

    private final JobLedgerRepository jobLedger;

    public JobAdminController(JobLedgerRepository jobLedger) {
        this.jobLedger = jobLedger;
    }

    @Operation(summary = "List failed jobs", description = "Most recently failed first.")
    @GetMapping("/failed")
    public List<JobRecord> failed(
            @Parameter(description = "Maximum rows to return") @RequestParam(defaultValue = "100") int limit) {
        return jobLedger.findFailed(Math.max(1, Math.min(limit, MAX_LIMIT)));
    }
}
