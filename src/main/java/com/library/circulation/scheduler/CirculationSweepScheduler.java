package com.library.circulation.scheduler;

import com.library.circulation.service.CirculationCoordinator;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically persists overdue transitions and expires stale reservations. Reads never
 * depend on this having run; it keeps stored state and queue positions close to reality.
 *
 * <p>Disabled with {@code library.circulation.sweep.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "library.circulation.sweep", name = "enabled", havingValue = "true",
    matchIfMissing = true)
public class CirculationSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(CirculationSweepScheduler.class);

    private final CirculationCoordinator coordinator;
    private final Clock clock;

    @Scheduled(cron = "${library.circulation.sweep.cron:0 0 * * * *}")
    public void sweep() {
        Instant now = Instant.now(clock);
        log.info("Circulation sweep started at {}", now);
        try {
            coordinator.sweepOverdue(now);
        } catch (Exception e) {
            log.error("Overdue sweep failed", e);
        }
        try {
            coordinator.expireStaleReservations(now);
        } catch (Exception e) {
            log.error("Reservation expiry sweep failed", e);
        }
    }
}
