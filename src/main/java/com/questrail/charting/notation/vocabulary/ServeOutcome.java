package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * ServeOutcome
 * -----------------------------------------------------------------------------
 * Classification of a single serve attempt.
 *
 * <p>{@link #ACE} and {@link #SERVICE_WINNER} put the ball in play but end the
 * point on the serve itself, so neither is followed by a rally. Only
 * {@link #IN_PLAY} hands the remainder of the code to the rally decoder.</p>
 */
public enum ServeOutcome
{
    /** The serve did not land in the service box. */
    FAULT(null),

    /** Untouched serve ({@code *}). */
    ACE('*'),

    /** Touched but unreturnable serve ({@code #}). */
    SERVICE_WINNER('#'),

    /** The return was struck and the rally continues. */
    IN_PLAY(null);

    private static final Map<Character, ServeOutcome> BY_MARKER =
            NotationTable.index(values(), ServeOutcome::marker);

    private final Character marker;

    ServeOutcome(Character marker)
    {
        this.marker = marker;
    }

    /**
     * @return the notation marker, or {@code null} for outcomes with no marker of their own
     */
    public Character marker()
    {
        return marker;
    }

    public boolean endsPointOnServe()
    {
        return this == ACE || this == SERVICE_WINNER;
    }

    public static Optional<ServeOutcome> fromMarker(char c)
    {
        return Optional.ofNullable(BY_MARKER.get(c));
    }
}
