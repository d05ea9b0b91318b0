package com.github.mirrorfetch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AvailabilityRecord {
    String mirrorBaseUrl;
    String identifier;
    Availability availability;
    Instant verifiedAt;
}
