package com.phillippitts.autoremediation.service.ratelimit;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.ActionWindowEntry;
import com.phillippitts.autoremediation.domain.RemediationSettings;
import com.phillippitts.autoremediation.service.store.RemediationStateStore;
import com.phillippitts.autoremediation.service.store.StoreTransaction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Sliding-window cap on remediation attempts per {@code (service, action type)}.
 *
 * <p>Counts every attempt, successful or not, so it limits frequency independently of the
 * circuit breaker. When the window cannot be read the attempt is denied.
 */
@Component
public class ActionRateLimiter {

    private static final Logger LOG = LogManager.getLogger(ActionRateLimiter.class);

    private final RemediationStateStore store;
    private final Clock clock;

    public ActionRateLimiter(RemediationStateStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns true when fewer than {@code maxActionsPerWindow} attempts were recorded for the pair
     * within the last {@code window}.
     */
    public boolean allow(String service, ActionType actionType, RemediationSettings.Limits limits) {
        Instant since = clock.instant().minus(limits.window());
        try {
            int count = store.countActionWindowEntries(service, actionType, since);
            if (count >= limits.maxActionsPerWindow()) {
                LOG.warn("Rate limit reached for {}/{}: {} attempts in the last {}s (max {})",
                        service, actionType.code(), count, limits.window().toSeconds(),
                        limits.maxActionsPerWindow());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            LOG.error("Action window unavailable for {}/{}: {}", service, actionType.code(), e.toString());
            return false;
        }
    }

    /** Appends one window entry for an attempt inside the caller's transaction. */
    public void recordAttempt(StoreTransaction tx, String service, ActionType actionType, boolean success) {
        tx.appendActionWindowEntry(new ActionWindowEntry(service, actionType, clock.instant(), success));
    }
}
