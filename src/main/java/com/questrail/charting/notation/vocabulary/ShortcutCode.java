package com.questrail.charting.notation.vocabulary;

import java.util.Map;
import java.util.Optional;

/**
 * Single-character whole-point codes.
 *
 * <p>A shortcut is only recognized when the first serve code consists of that
 * one character. It replaces the entire shot-level description of the point.</p>
 */
public enum ShortcutCode
{
    /** Server won a point whose shots were not charted. */
    SERVER_WON_NOT_CODED('S', PointShape.NOT_CODED),

    /** Returner won a point whose shots were not charted. */
    RETURNER_WON_NOT_CODED('R', PointShape.NOT_CODED),

    /** Point penalty against the server. */
    SERVER_PENALTY('P', PointShape.SERVER_LOST_OUTRIGHT),

    /** Point penalty against the returner. */
    RETURNER_PENALTY('Q', PointShape.SERVER_WON_OUTRIGHT);

    private static final Map<Character, ShortcutCode> BY_CODE =
            NotationTable.index(values(), ShortcutCode::code);

    private final char code;
    private final PointShape shape;

    ShortcutCode(char code, PointShape shape)
    {
        this.code = code;
        this.shape = shape;
    }

    public char code()
    {
        return code;
    }

    /**
     * @return the point shape this shortcut produces
     */
    public PointShape shape()
    {
        return shape;
    }

    public static Optional<ShortcutCode> fromCode(char c)
    {
        return Optional.ofNullable(BY_CODE.get(c));
    }
}
