package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * ShotOutcome
 * -----------------------------------------------------------------------------
 * Result of a single rally shot.
 *
 * <p>Every shot but the last one of a rally is {@link #IN_PLAY}. The terminal
 * markers ({@code *}, {@code #}, {@code @}) may only appear on the final shot.</p>
 */
public enum ShotOutcome
{
    IN_PLAY(null),
    WINNER('*'),
    FORCED_ERROR('#'),
    UNFORCED_ERROR('@');

    private static final Map<Character, ShotOutcome> BY_MARKER =
            NotationTable.index(values(), ShotOutcome::marker);

    private final Character marker;

    ShotOutcome(Character marker)
    {
        this.marker = marker;
    }

    /**
     * @return the notation marker, or {@code null} for {@link #IN_PLAY}
     */
    public Character marker()
    {
        return marker;
    }

    public boolean isTerminal()
    {
        return this != IN_PLAY;
    }

    public boolean isError()
    {
        return this == FORCED_ERROR || this == UNFORCED_ERROR;
    }

    public static Optional<ShotOutcome> fromMarker(char c)
    {
        return Optional.ofNullable(BY_MARKER.get(c));
    }
}
