package com.github.mirrorfetch.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for submitting a batch.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchSubmission {

    @NotEmpty
    @Valid
    private List<TransferRequest> requests = new ArrayList<>();

    /**
     * Overrides the configured default when set.
     */
    @Min(1)
    private Integer maxConcurrency;
}
