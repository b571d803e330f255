package com.questrail.charting.match;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MatchScoreTest
{
    @Test
    void parseThreeSetsWithTiebreak()
    {
        MatchScore score = MatchScore.parse("6-4 3-6 7-6(5)");

        assertEquals(3, score.sets().size());
        assertTrue(score.isCompleted());
        assertEquals(2, score.setsWonByWinner());
        assertEquals(1, score.setsWonByLoser());

        SetScore third = score.sets().get(2);
        assertTrue(third.hadTiebreak());
        assertEquals(5, third.tiebreakPoints().getAsInt());
        assertEquals("7-6(5)", third.toString());
    }

    @Test
    void parseMatchTiebreak()
    {
        MatchScore score = MatchScore.parse("6-4 6-7(3) [10-8]");

        assertTrue(score.sets().get(2).matchTiebreak());
        assertEquals(2, score.setsWonByWinner());
    }

    @Test
    void parseAdvantageAndTwelveAllSets()
    {
        assertEquals(3, MatchScore.parse("7-5 4-6 8-6").sets().size());
        assertEquals(3, MatchScore.parse("6-4 4-6 13-12(4)").sets().size());
    }

    @Test
    void retirementAllowsAnUnfinishedLastSet()
    {
        MatchScore score = MatchScore.parse("6-4 2-1 RET");

        assertEquals(MatchScore.Completion.RETIRED, score.completion());
        assertFalse(score.sets().get(1).isComplete());
    }

    @Test
    void walkoverHasNoSets()
    {
        MatchScore score = MatchScore.parse("W/O");

        assertEquals(MatchScore.Completion.WALKOVER, score.completion());
        assertTrue(score.sets().isEmpty());
    }

    @Test
    void rejectImpossibleSet()
    {
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("6-5 6-4"));
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("6-4 7-7"));
    }

    @Test
    void rejectWinnerWhoLostOnSets()
    {
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("4-6 3-6"));
    }

    @Test
    void rejectMarkerBeforeTheLastToken()
    {
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("6-4 RET 6-3"));
    }

    @Test
    void rejectTiebreakPointsOnARegularSet()
    {
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("6-4(3) 6-4"));
    }

    @Test
    void rejectGarbage()
    {
        ScoreFormatException e = assertThrows(ScoreFormatException.class, () -> MatchScore.parse("six-four"));
        assertEquals("six-four", e.score());
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("  "));
        assertThrows(ScoreFormatException.class, () -> MatchScore.parse("[10-8] 6-4 6-4"));
    }
}
