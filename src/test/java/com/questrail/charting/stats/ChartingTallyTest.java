package com.questrail.charting.stats;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.internal.decode.ShotSequenceDecoder;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.notation.vocabulary.ShotType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ChartingTallyTest
{
    private static final Player A = Player.of("A");
    private static final Player B = Player.of("B");

    private final ShotSequenceDecoder decoder = ShotSequenceDecoder.withDefaults();

    private List<ShotSequence> samplePoints()
    {
        return List.of(
                decoder.decode(A, B, true, "6*", null),
                decoder.decode(A, B, true, "4#", null),
                decoder.decode(A, B, false, "4n", "5d"),
                decoder.decode(A, B, true, "6f1b2*", null),
                decoder.decode(A, B, true, "n", "6f1@"),
                decoder.decode(A, B, true, "S", null),
                decoder.decode(A, B, false, "P", null));
    }

    @Test
    void countsServeOutcomes()
    {
        ChartingTally tally = ChartingTally.of(samplePoints());

        assertEquals(7, tally.points());
        assertEquals(1, tally.notCoded());
        assertEquals(1, tally.outright());
        assertEquals(5, tally.firstServesPlayed());
        assertEquals(3, tally.firstServesIn());
        assertEquals(0.6, tally.firstServePercentage(), 1e-9);
        assertEquals(1, tally.aces());
        assertEquals(1, tally.serviceWinners());
        assertEquals(1, tally.doubleFaults());
    }

    @Test
    void countsRallyEndingsAndShots()
    {
        ChartingTally tally = ChartingTally.of(samplePoints());

        assertEquals(1, tally.winners());
        assertEquals(0, tally.forcedErrors());
        assertEquals(1, tally.unforcedErrors());
        assertEquals(Map.of(0, 3, 1, 1, 2, 1), tally.rallyLengths());
        assertEquals(2, tally.shotCount(ShotType.FOREHAND));
        assertEquals(1, tally.shotCount(ShotType.BACKHAND));
        assertEquals(0, tally.shotCount(ShotType.OVERHEAD));
    }

    @Test
    void mergeAddsCounts()
    {
        ChartingTally left = ChartingTally.of(samplePoints());
        ChartingTally right = ChartingTally.of(samplePoints());

        left.merge(right);

        assertEquals(14, left.points());
        assertEquals(2, left.aces());
        assertEquals(6, left.rallyLengths().get(0));
        assertEquals(4, left.shotCount(ShotType.FOREHAND));
    }

    @Test
    void emptyTallyHasNoFirstServePercentage()
    {
        assertTrue(Double.isNaN(new ChartingTally().firstServePercentage()));
    }
}
