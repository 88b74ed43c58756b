package com.recaprio.projection.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code app.kafka} for the base row change feed.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.kafka")
public class ChangeFeedProperties {

    private boolean enabled = true;

    @Valid
    private Topics topics = new Topics();

    @Valid
    private Redelivery redelivery = new Redelivery();

    @Data
    public static class Topics {
        @NotBlank
        private String baseChanges = "base-row-changes";
    }

    /**
     * How a record whose processing throws is redelivered before it goes to the
     * dead-letter topic.
     */
    @Data
    public static class Redelivery {
        @NotNull
        private Duration interval = Duration.ofSeconds(1);
        /** Redeliveries after the first failed attempt. */
        @Min(0)
        private long attempts = 2;
    }
}
