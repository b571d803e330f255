package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Where a rally shot was sent, described from a right-hander's point of view.
 * A shot with no direction digit is {@link #UNKNOWN}.
 */
public enum ShotDirection
{
    FOREHAND_SIDE('1'),
    MIDDLE('2'),
    BACKHAND_SIDE('3'),
    UNKNOWN('0');

    private static final Map<Character, ShotDirection> BY_CODE =
            NotationTable.index(values(), ShotDirection::code);

    private final char code;

    ShotDirection(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<ShotDirection> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
