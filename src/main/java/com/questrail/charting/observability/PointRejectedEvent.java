package com.questrail.charting.observability;

import com.questrail.charting.notation.internal.decode.ChartingDecodeException;

import java.time.Instant;

/**
 * Record representing a charted point that was dropped because its codes
 * could not be decoded.
 */
public record PointRejectedEvent(
    Instant timestamp,
    String matchId,
    int pointNumber,
    String firstCode,
    String secondCode,
    ChartingDecodeException cause
) {
    /**
     * Returns the failure kind, e.g. {@code UnknownCodeException}.
     */
    public String failureKind() {
        return cause.getClass().getSimpleName();
    }
}
