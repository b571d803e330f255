package com.questrail.charting.observability;

import com.questrail.charting.notation.model.ShotSequence;

import java.time.Instant;

/**
 * Record representing a successfully decoded charted point.
 */
public record PointDecodedEvent(
    Instant timestamp,
    String matchId,
    int pointNumber,
    ShotSequence sequence
) {
}
