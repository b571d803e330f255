package com.questrail.charting.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used to timestamp observability events.
 *
 * <p>Decoding itself never reads the clock. Tests inject a fixed clock so that
 * recorded events compare deterministically.</p>
 */
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
