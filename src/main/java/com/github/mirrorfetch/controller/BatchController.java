package com.github.mirrorfetch.controller;

import com.github.mirrorfetch.model.BatchSubmission;
import com.github.mirrorfetch.model.BatchSummary;
import com.github.mirrorfetch.model.TransferRequest;
import com.github.mirrorfetch.service.BatchService;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Valid;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Objects;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/batches")
@RequiredArgsConstructor
public class BatchController {

    private final BatchService batchService;
    private final Validator validator;

    /**
     * Submit a batch; runs in the background
     */
    @PostMapping
    public ResponseEntity<BatchSummary> submit(@Valid @RequestBody BatchSubmission submission) {
        log.info("Submitting batch of {} requests", submission.getRequests().size());
        BatchSummary summary = batchService.submit(submission.getRequests(), submission.getMaxConcurrency());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary);
    }

    @GetMapping
    public ResponseEntity<List<BatchSummary>> getAllBatches() {
        return ResponseEntity.ok(batchService.getAllBatches());
    }

    @GetMapping("/{id}")
    public ResponseEntity<BatchSummary> getBatch(@PathVariable String id) {
        return batchService.getBatch(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Cancel a running batch
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cancelBatch(@PathVariable String id) {
        boolean cancelled = batchService.cancel(id);
        return cancelled ? ResponseEntity.ok().build() : ResponseEntity.notFound().build();
    }

    /**
     * Filter the given requests down to those with a resumable partial file
     */
    @PostMapping("/resumable")
    public ResponseEntity<List<TransferRequest>> findResumable(@RequestBody List<TransferRequest> requests) {
        for (TransferRequest request : requests) {
            if (request == null) {
                return ResponseEntity.badRequest().build();
            }
            Set<ConstraintViolation<TransferRequest>> violations = validator.validate(request);
            if (!violations.isEmpty()) {
                log.debug("Rejected resumable lookup for {}: {} invalid field(s)",
                        Objects.toString(request.getIdentifier(), "<no identifier>"), violations.size());
                return ResponseEntity.badRequest().build();
            }
        }
        return ResponseEntity.ok(batchService.findResumable(requests));
    }
}
