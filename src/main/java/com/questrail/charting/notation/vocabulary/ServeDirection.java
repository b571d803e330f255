package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Placement of a serve within the service box.
 */
public enum ServeDirection
{
    WIDE('4'),
    BODY('5'),
    DOWN_THE_T('6'),
    UNKNOWN('0');

    private static final Map<Character, ServeDirection> BY_CODE =
            NotationTable.index(values(), ServeDirection::code);

    private final char code;

    ServeDirection(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<ServeDirection> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
