package com.questrail.charting.ingest;

import com.questrail.charting.api.Player;

import java.util.Objects;

/**
 * One charted point as supplied by the tabular loading layer.
 *
 * @param matchId     identifier of the charted match the point belongs to
 * @param pointNumber 1-based position of the point within the match
 * @param firstCode   first serve column (or a single-character shortcut)
 * @param secondCode  second serve column; {@code null} or blank when empty
 */
public record ChartedPoint(
        String matchId,
        int pointNumber,
        Player server,
        Player returner,
        boolean serverWon,
        String firstCode,
        String secondCode
)
{
    public ChartedPoint
    {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(returner, "returner");
        if (pointNumber < 1) {
            throw new IllegalArgumentException("pointNumber must be >= 1 (was " + pointNumber + ")");
        }
    }
}
