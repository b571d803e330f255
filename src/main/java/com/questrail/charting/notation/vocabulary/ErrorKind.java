package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * How a rally shot missed. Only meaningful together with
 * {@link ShotOutcome#FORCED_ERROR} or {@link ShotOutcome#UNFORCED_ERROR}.
 */
public enum ErrorKind
{
    NET('n'),
    WIDE('w'),
    DEEP('d'),
    WIDE_AND_DEEP('x'),
    SHANK('!'),
    UNKNOWN('e');

    private static final Map<Character, ErrorKind> BY_CODE =
            NotationTable.index(values(), ErrorKind::code);

    private final char code;

    ErrorKind(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<ErrorKind> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
