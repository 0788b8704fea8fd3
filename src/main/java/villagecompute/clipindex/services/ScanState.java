package villagecompute.clipindex.services;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a channel scan.
 *
 * <p>
 * <b>Transitions:</b>
 *
 * <pre>
 * (none), SUCCEEDED, FAILED, CANCELLED -> PENDING     enqueue, manual retry, explicit rescan
 * PENDING                              -> RUNNING     worker picks the job up
 * RUNNING                              -> SUCCEEDED   limit reached or history exhausted
 * RUNNING                              -> PENDING     auto-continue requeues the next chunk
 * PENDING, RUNNING                     -> FAILED      unrecoverable error or dead-lettered job
 * PENDING, RUNNING                     -> CANCELLED   purge, explicit stop, stale recovery
 * </pre>
 *
 * <p>
 * {@link ScanStateService} turns each transition into a conditional update whose {@code WHERE status IN (...)} clause
 * is {@link #allowedSources()}.
 */
public enum ScanState {

    PENDING, RUNNING, SUCCEEDED, FAILED, CANCELLED;

    private static final Set<ScanState> ACTIVE = EnumSet.of(PENDING, RUNNING);

    /**
     * States from which a transition into this state is legal.
     */
    public Set<ScanState> allowedSources() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, SUCCEEDED, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(PENDING);
            case SUCCEEDED -> EnumSet.of(RUNNING);
            case FAILED, CANCELLED -> EnumSet.of(PENDING, RUNNING);
        };
    }

    public boolean canTransitionTo(ScanState target) {
        return target.allowedSources().contains(this);
    }

    /**
     * PENDING and RUNNING mark a channel as busy; at most one such row exists per channel.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public static Set<ScanState> activeStates() {
        return EnumSet.copyOf(ACTIVE);
    }
}
