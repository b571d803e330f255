package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * ShotType
 * -----------------------------------------------------------------------------
 * The stroke used for a single rally shot. Every shot token in a rally code
 * begins with one of these letters; no modifier character shares a letter with
 * a shot type, which is what lets the rally decoder split tokens without
 * lookahead.
 */
public enum ShotType
{
    FOREHAND('f'),
    BACKHAND('b'),
    FOREHAND_SLICE('r'),
    BACKHAND_SLICE('s'),
    FOREHAND_VOLLEY('v'),
    BACKHAND_VOLLEY('z'),
    OVERHEAD('o'),
    BACKHAND_OVERHEAD('p'),
    FOREHAND_DROP_SHOT('u'),
    BACKHAND_DROP_SHOT('y'),
    FOREHAND_LOB('l'),
    BACKHAND_LOB('m'),
    FOREHAND_HALF_VOLLEY('h'),
    BACKHAND_HALF_VOLLEY('i'),
    FOREHAND_SWINGING_VOLLEY('j'),
    BACKHAND_SWINGING_VOLLEY('k'),
    TRICK_SHOT('t'),
    UNKNOWN('q');

    private static final Map<Character, ShotType> BY_CODE =
            NotationTable.index(values(), ShotType::code);

    private final char code;

    ShotType(char code)
    {
        this.code = code;
    }

    public char code()
    {
        return code;
    }

    public boolean isVolley()
    {
        return switch (this) {
            case FOREHAND_VOLLEY, BACKHAND_VOLLEY,
                 FOREHAND_HALF_VOLLEY, BACKHAND_HALF_VOLLEY,
                 FOREHAND_SWINGING_VOLLEY, BACKHAND_SWINGING_VOLLEY -> true;
            default -> false;
        };
    }

    public static Optional<ShotType> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }

    public static boolean isShotCode(char c)
    {
        return BY_CODE.containsKey(c);
    }
}
