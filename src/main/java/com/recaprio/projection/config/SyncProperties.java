package com.recaprio.projection.config;

import com.recaprio.projection.model.ProjectionMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code app.sync}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    /** Physical shape of the projection store. */
    @NotNull
    private ProjectionMode mode = ProjectionMode.INLINE;

    /** Maximum accepted lag between a base commit and its projection. Zero means synchronous. */
    @NotNull
    private Duration stalenessWindow = Duration.ZERO;

    /** Retries after the first failed attempt before a key is given up on. */
    @Min(0)
    private int retryLimit = 3;

    /** Let the consistency monitor repair the drift it finds. */
    private boolean selfHeal = false;

    @NotNull
    private Duration upsertTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration initialBackoff = Duration.ofMillis(200);

    @DecimalMin("1.0")
    private double backoffMultiplier = 2.0;

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(10);

    /** Stripes of the per-key worker pool. */
    @Min(1)
    private int workers = 4;

    @Min(1)
    private int scanPageSize = 500;

    @Valid
    private Rule rule = new Rule();

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Outbox outbox = new Outbox();

    @Valid
    private Retention retention = new Retention();

    public boolean isSynchronous() {
        return stalenessWindow.isZero() || stalenessWindow.isNegative();
    }

    @Data
    public static class Rule {
        @DecimalMin(value = "0.0", inclusive = false)
        private double ghzPerCore = 2.4;
    }

    @Data
    public static class Monitor {
        private boolean enabled = true;
        private String cron = "0 */15 * * * *";
        @Min(1)
        private int batchSize = 500;
    }

    @Data
    public static class Outbox {
        /** How often PENDING entries are checked for replay, in milliseconds. */
        private long relayIntervalMs = 30000;
        /** Age a PENDING entry must reach before it is treated as lost. */
        @NotNull
        private Duration relayGrace = Duration.ofMinutes(1);
        @Min(1)
        private int relayBatchSize = 200;
    }

    @Data
    public static class Retention {
        private String cron = "0 0 2 * * *";
        @NotNull
        private Duration summarySoftDeleted = Duration.ofDays(30);
        @NotNull
        private Duration viewTombstone = Duration.ofDays(1);
        @NotNull
        private Duration outboxApplied = Duration.ofDays(7);
        @NotNull
        private Duration resolvedDrift = Duration.ofDays(30);
        @NotNull
        private Duration idleKeyState = Duration.ofHours(1);
    }
}
