package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Depth of a shot, normally only charted for returns.
 */
public enum ShotDepth
{
    /** Landed within the service boxes. */
    SHALLOW('7'),

    /** Landed behind the service line, in the front half of the back court. */
    MEDIUM('8'),

    /** Landed close to the baseline. */
    DEEP('9');

    private static final Map<Character, ShotDepth> BY_CODE =
            NotationTable.index(values(), ShotDepth::code);

    private final char code;

    ShotDepth(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<ShotDepth> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
