package com.questrail.charting.observability;

import java.time.Instant;

/**
 * Record summarizing one bulk decode.
 */
public record BatchCompletedEvent(
    Instant timestamp,
    int decoded,
    int rejected
) {
    public int total() {
        return decoded + rejected;
    }
}
