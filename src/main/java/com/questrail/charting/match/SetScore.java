package com.questrail.charting.match;

import java.util.OptionalInt;

/**
 * Games won in one set, from the match winner's perspective.
 *
 * @param tiebreakPoints loser's points in the deciding tiebreak, when charted
 * @param matchTiebreak  {@code true} for a match tiebreak played in place of a
 *                       deciding set, in which case the games are tiebreak points
 */
public record SetScore(
        int winnerGames,
        int loserGames,
        OptionalInt tiebreakPoints,
        boolean matchTiebreak
)
{
    public SetScore
    {
        if (winnerGames < 0 || loserGames < 0) {
            throw new IllegalArgumentException("Games must be >= 0");
        }
        tiebreakPoints = (tiebreakPoints == null) ? OptionalInt.empty() : tiebreakPoints;
    }

    public static SetScore of(int winnerGames, int loserGames)
    {
        return new SetScore(winnerGames, loserGames, OptionalInt.empty(), false);
    }

    public boolean wonByMatchWinner()
    {
        return winnerGames > loserGames;
    }

    /**
     * Whether the set reached a legal finishing score.
     */
    public boolean isComplete()
    {
        final int hi = Math.max(winnerGames, loserGames);
        final int lo = Math.min(winnerGames, loserGames);

        if (matchTiebreak) {
            return hi >= 10 && hi - lo >= 2 && (hi == 10 || hi - lo == 2);
        }
        if (hi == 6) {
            return lo <= 4;
        }
        if (hi == 7) {
            return lo == 5 || lo == 6;
        }
        if (hi - lo == 1) {
            // final-set tiebreak at 12-12
            return hi == 13;
        }
        return hi > 7 && hi - lo == 2;
    }

    public boolean hadTiebreak()
    {
        final int hi = Math.max(winnerGames, loserGames);
        final int lo = Math.min(winnerGames, loserGames);
        return !matchTiebreak && hi - lo == 1 && (hi == 7 || hi == 13);
    }

    @Override
    public String toString()
    {
        String games = winnerGames + "-" + loserGames;
        if (matchTiebreak) {
            return "[" + games + "]";
        }
        return tiebreakPoints.isPresent() ? games + "(" + tiebreakPoints.getAsInt() + ")" : games;
    }
}
