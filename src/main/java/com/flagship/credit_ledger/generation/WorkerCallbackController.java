package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.generation.dto.CompleteJobRequest;
import com.flagship.credit_ledger.generation.dto.FailJobRequest;
import com.flagship.credit_ledger.generation.dto.GenerationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST alternative to the generation-results topic for workers. Every call is
 * safe to retry.
 */
@RestController
@RequestMapping("/internal/jobs/{jobId}")
@RequiredArgsConstructor
public class WorkerCallbackController {

    private final JobCoordinator jobCoordinator;

    @PostMapping("/processing")
    public GenerationResponse processing(@PathVariable("jobId") String jobId) {
        return GenerationResponse.from(jobCoordinator.markProcessing(jobId));
    }

    @PostMapping("/complete")
    public GenerationResponse complete(@PathVariable("jobId") String jobId,
                                       @Valid @RequestBody CompleteJobRequest request) {
        WorkerOutcome outcome = WorkerOutcome.completed(new GenerationResult(request.getImageUrl(), request.getSeed()));
        return GenerationResponse.from(jobCoordinator.report(jobId, outcome));
    }

    @PostMapping("/fail")
    public GenerationResponse fail(@PathVariable("jobId") String jobId,
                                   @Valid @RequestBody FailJobRequest request) {
        return GenerationResponse.from(jobCoordinator.report(jobId, WorkerOutcome.failed(request.getError())));
    }
}
