package com.questrail.charting.notation.model;

import java.util.List;
import java.util.Objects;

/**
 * Rally
 * =============================================================================
 * The shots exchanged after a serve was returned into play, in the order they
 * were struck.
 *
 * <p>A rally is never empty. Only the final shot may carry a terminal outcome;
 * every earlier shot is {@link com.questrail.charting.notation.vocabulary.ShotOutcome#IN_PLAY}.
 * A rally whose final shot is also in play was charted incompletely and
 * reports {@code false} from {@link #isComplete()}.</p>
 */
public record Rally(List<Shot> shots)
{
    public Rally
    {
        Objects.requireNonNull(shots, "shots");
        shots = List.copyOf(shots);

        if (shots.isEmpty()) {
            throw new IllegalArgumentException("Rally must contain at least one shot");
        }

        for (int i = 0; i < shots.size() - 1; i++) {
            if (shots.get(i).isTerminal()) {
                throw new IllegalArgumentException(
                        "Only the last shot of a rally may end the point (shot "
                                + (i + 1) + " of " + shots.size() + " is " + shots.get(i).outcome() + ")");
            }
        }
    }

    /**
     * @return number of shots, the return included
     */
    public int length()
    {
        return shots.size();
    }

    public Shot lastShot()
    {
        return shots.get(shots.size() - 1);
    }

    public boolean isComplete()
    {
        return lastShot().isTerminal();
    }
}
