package com.github.mirrorfetch.config;

import com.github.mirrorfetch.model.FailureSeverity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "mirrorfetch")
public class MirrorFetchProperties {

    @Valid
    private Registry registry = new Registry();
    @Valid
    private Health health = new Health();
    @Valid
    private Selection selection = new Selection();
    @Valid
    private Transfer transfer = new Transfer();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Coordinator coordinator = new Coordinator();

    @Data
    public static class Registry {
        @NotBlank
        private String mirrorFile = System.getProperty("user.home") + "/.mirrorfetch/mirrors.json";

        /**
         * Write the mirror list back after every batch and health check.
         */
        private boolean autosave = true;

        /**
         * Seed list used when no mirror file exists yet.
         */
        @Valid
        private List<MirrorDefinition> defaults = new ArrayList<>();

        public Path getMirrorFilePath() {
            return Paths.get(mirrorFile);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MirrorDefinition {
        @NotBlank
        private String name;

        @NotBlank
        private String baseUrl;

        private String country;

        @Min(0)
        private int priority = 1;
    }

    @Data
    public static class Health {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double successIncrement = 0.1;

        /**
         * Decrement for failures that may reflect catalog gaps rather than an unreliable mirror.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minorDecrement = 0.05;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double moderateDecrement = 0.2;

        /**
         * Decrement when a mirror cannot be reached at all.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double severeDecrement = 0.3;

        @Min(1)
        private int failureDecayStep = 1;

        /**
         * A health check deactivates a mirror once its failure count exceeds this.
         */
        @Min(1)
        private int failureThreshold = 3;

        @Min(1)
        private int checkTimeoutSeconds = 10;

        public double decrementFor(FailureSeverity severity) {
            switch (severity) {
                case MINOR:
                    return minorDecrement;
                case MODERATE:
                    return moderateDecrement;
                default:
                    return severeDecrement;
            }
        }
    }

    @Data
    public static class Selection {
        private List<String> preferredCountries = new ArrayList<>();

        @DecimalMin("1.0")
        private double countryBonus = 1.5;

        /**
         * Mirrors chosen within this window get {@link #recencyPenalty} applied. Zero disables it.
         */
        private Duration recencyWindow = Duration.ofSeconds(2);

        @DecimalMin("0.01")
        @DecimalMax("1.0")
        private double recencyPenalty = 0.5;

        public boolean isPreferredCountry(String country) {
            if (country == null) {
                return false;
            }
            return preferredCountries.stream()
                    .anyMatch(preferred -> preferred.toUpperCase(Locale.ROOT).equals(country.toUpperCase(Locale.ROOT)));
        }
    }

    @Data
    public static class Transfer {
        @Min(1)
        private int connectTimeoutSeconds = 10;

        @Min(1)
        private int readTimeoutSeconds = 30;

        @Min(1)
        private int writeTimeoutSeconds = 30;

        @Min(512)
        private int bufferSize = 8192;

        @NotBlank
        private String userAgent = "MirrorFetch/1.0";
    }

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttemptsPerTask = 6;

        /**
         * Timeouts and resets tolerated on one mirror before moving to another.
         */
        @Min(0)
        private int maxSameMirrorRetries = 2;

        @Min(0)
        private int maxRateLimitRetries = 3;

        @Min(0)
        private long baseDelayMs = 500;

        @Min(1)
        private int backoffMultiplier = 2;

        @Min(0)
        private long maxDelayMs = 30_000;
    }

    @Data
    public static class Coordinator {
        @Min(1)
        private int maxConcurrency = 3;

        /**
         * Finished batch summaries kept for status queries; older ones are dropped.
         */
        @Min(1)
        private int retainedBatches = 100;
    }
}
