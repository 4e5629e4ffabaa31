package com.library.circulation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Circulation policy inputs, bound from {@code library.circulation.*}.
 */
@Validated
@Getter
@Setter
@ConfigurationProperties(prefix = "library.circulation")
public class CirculationProperties {

    /** How long a loan runs from issue, and how far a renewal extends it from "now". */
    @NotNull
    private Duration loanPeriod = Duration.ofDays(14);

    @Min(0)
    private int maxRenewals = 2;

    @NotNull
    @DecimalMin("0.00")
    private BigDecimal finePerDay = new BigDecimal("1.00");

    /** How long a pending reservation waits in the queue before it expires. */
    @NotNull
    private Duration reservationExpiry = Duration.ofDays(7);

    @Valid
    private final Retry retry = new Retry();

    @Valid
    private final Sweep sweep = new Sweep();

    @Getter
    @Setter
    public static class Retry {

        /** Total attempts for a per-title unit, including the first one. */
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialBackoff = Duration.ofMillis(50);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Sweep {

        private boolean enabled = true;

        private String cron = "0 0 * * * *";
    }
}
