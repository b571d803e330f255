package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Where the hitter stood, when the charter recorded it.
 */
public enum CourtPosition
{
    APPROACH('+'),
    AT_NET('-'),
    BASELINE('=');

    private static final Map<Character, CourtPosition> BY_CODE =
            NotationTable.index(values(), CourtPosition::code);

    private final char code;

    CourtPosition(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<CourtPosition> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
