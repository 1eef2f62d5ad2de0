package com.flagship.credit_ledger.generation;

import com.flagship.credit_ledger.generation.dto.CancelGenerationRequest;
import com.flagship.credit_ledger.generation.dto.CreateGenerationRequest;
import com.flagship.credit_ledger.generation.dto.GenerationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/generations")
@RequiredArgsConstructor
public class GenerationController {

    private final JobCoordinator jobCoordinator;

    /**
     * Reserves credits and queues the job. 202: the image arrives later through a
     * GenerationCompleted notification.
     */
    @PostMapping
    public ResponseEntity<GenerationResponse> createGeneration(@Valid @RequestBody CreateGenerationRequest request) {
        Generation generation = jobCoordinator.createJob(request.getUserId(), request.getPrompt(),
                request.getReferenceImages(), request.getSettings());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(GenerationResponse.from(generation));
    }

    @GetMapping("/{id}")
    public GenerationResponse getGeneration(@PathVariable("id") UUID id) {
        return GenerationResponse.from(jobCoordinator.getGeneration(id));
    }

    @GetMapping
    public List<GenerationResponse> getGenerations(@RequestParam("userId") long userId) {
        return jobCoordinator.getGenerations(userId).stream().map(GenerationResponse::from).toList();
    }

    @PostMapping("/{id}/cancel")
    public GenerationResponse cancel(@PathVariable("id") UUID id,
                                     @Valid @RequestBody CancelGenerationRequest request) {
        return GenerationResponse.from(jobCoordinator.cancel(id, request.getUserId()));
    }
}
