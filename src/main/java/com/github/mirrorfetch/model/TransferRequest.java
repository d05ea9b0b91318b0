package com.github.mirrorfetch.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * One identifier-to-destination pair as supplied by the caller.
 * The canonical path comes from the catalog and is appended to each mirror's base URL.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferRequest {

    @NotBlank
    private String identifier;

    @NotBlank
    private String canonicalPath;

    @NotBlank
    private String destination;

    private Long expectedSize;

    @Builder.Default
    private TaskPriority priority = TaskPriority.NORMAL;

    @JsonIgnore
    public Path getDestinationPath() {
        return Paths.get(destination);
    }
}
