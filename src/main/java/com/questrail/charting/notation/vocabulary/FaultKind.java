package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Ways a serve can miss.
 *
 * <p>A bare fault letter with no preceding direction digit is accepted as a
 * fault of unknown direction; see {@link ServeDirection#UNKNOWN}.</p>
 */
public enum FaultKind
{
    NET('n'),
    WIDE('w'),
    DEEP('d'),
    WIDE_AND_DEEP('x'),
    FOOT_FAULT('g'),
    UNKNOWN('e'),
    SHANK('!'),
    TIME_VIOLATION('V');

    private static final Map<Character, FaultKind> BY_CODE =
            NotationTable.index(values(), FaultKind::code);

    private final char code;

    FaultKind(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public static Optional<FaultKind> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }

    public static boolean isFaultCode(char c)
    {
        return BY_CODE.containsKey(c);
    }
}
