package com.questrail.charting.api;

import java.util.Objects;

/**
 * Player
 * -----------------------------------------------------------------------------
 * Identity of a player as it appears in a charted match.
 *
 * <p>The charting corpus identifies players by display name only, so the name
 * is the identity. Two {@code Player} values with the same name are the same
 * player. Leading and trailing whitespace is not significant and is removed.</p>
 *
 * <p>Using a dedicated type rather than a raw {@code String} keeps server and
 * returner arguments from being confused with notation codes, which are also
 * strings and travel through the same call sites.</p>
 */
public record Player(String name)
{
    public Player
    {
        Objects.requireNonNull(name, "name");
        name = name.strip();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Player name must not be blank");
        }
    }

    public static Player of(String name)
    {
        return new Player(name);
    }

    @Override
    public String toString()
    {
        return name;
    }
}
