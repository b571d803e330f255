package com.questrail.charting.notation.internal.decode;

import com.questrail.charting.api.Player;
import com.questrail.charting.config.ChartingDecoderConfig;
import com.questrail.charting.notation.model.Rally;
import com.questrail.charting.notation.model.Serve;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.PointShape;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ShotSequenceDecoder}.
 *
 * These tests validate the point-level boundary:
 *   (first code, second code) -> ShotSequence
 */
final class ShotSequenceDecoderTest
{
    private static final Player A = Player.of("A");
    private static final Player B = Player.of("B");

    private final ShotSequenceDecoder decoder = ShotSequenceDecoder.withDefaults();

    // ---------------------------------------------------------------------
    // Single-character shortcuts
    // ---------------------------------------------------------------------

    @Test
    void serverWonNotCoded()
    {
        ShotSequence seq = decoder.decode(A, B, true, "S", null);

        assertTrue(seq.notCoded());
        assertEquals(PointShape.NOT_CODED, seq.shape());
        assertTrue(seq.firstServe().isEmpty());
        assertTrue(seq.secondServe().isEmpty());
        assertTrue(seq.rally().isEmpty());
    }

    @Test
    void returnerWonNotCoded()
    {
        ShotSequence seq = decoder.decode(A, B, false, "R", null);

        assertTrue(seq.notCoded());
        assertEquals(B, seq.winner());
    }

    @Test
    void shortcutNeverConsultsTheSecondCode()
    {
        ShotSequence seq = decoder.decode(A, B, true, "S", "???");

        assertTrue(seq.notCoded());
    }

    @Test
    void penaltyShortcuts()
    {
        ShotSequence lost = decoder.decode(A, B, false, "P", null);
        assertTrue(lost.serverLostOutright());
        assertFalse(lost.serverWon());

        ShotSequence won = decoder.decode(A, B, true, "Q", null);
        assertTrue(won.serverWonOutright());
        assertTrue(won.serverWon());
    }

    @Test
    void penaltyShortcutsKeepTheChartedWinner()
    {
        ShotSequence lost = decoder.decode(A, B, true, "P", null);
        assertTrue(lost.serverLostOutright());
        assertTrue(lost.serverWon());
        assertEquals(A, lost.winner());

        ShotSequence won = decoder.decode(A, B, false, "Q", null);
        assertTrue(won.serverWonOutright());
        assertFalse(won.serverWon());
        assertEquals(B, won.winner());
    }

    @Test
    void serverCannotReturnTheirOwnServe()
    {
        MalformedSequenceException e = assertThrows(MalformedSequenceException.class,
                () -> decoder.decode(A, A, true, "S", null));
        assertEquals("A", e.offendingCode());

        assertThrows(MalformedSequenceException.class,
                () -> decoder.decode(A, Player.of(" A "), true, "6f1b2*", null));
    }

    @Test
    void unknownSingleCharacterIsRejected()
    {
        UnknownCodeException e = assertThrows(UnknownCodeException.class,
                () -> decoder.decode(A, B, true, "Z", null));
        assertEquals("Z", e.offendingCode());

        assertThrows(UnknownCodeException.class,
                () -> decoder.decode(A, B, true, "6", null));
    }

    // ---------------------------------------------------------------------
    // Fault handling
    // ---------------------------------------------------------------------

    @Test
    void bareNetFaultRequiresASecondServe()
    {
        ShotSequence seq = decoder.decode(A, B, true, "n", "4*");

        Serve first = seq.firstServe().orElseThrow();
        assertEquals(FaultKind.NET, first.fault().orElseThrow());
        assertEquals(ServeDirection.UNKNOWN, first.direction());
        assertEquals(ServeOutcome.ACE, seq.secondServe().orElseThrow().outcome());
        assertTrue(seq.rally().isEmpty());
        assertTrue(seq.isAce());
    }

    @Test
    void bareFaultWithoutSecondCodeIsMissingServe()
    {
        assertThrows(MissingServeException.class,
                () -> decoder.decode(A, B, true, "n", null));
        assertThrows(MissingServeException.class,
                () -> decoder.decode(A, B, true, "6d", "  "));
    }

    @Test
    void bareFaultRejectedWhenLeniencyDisabled()
    {
        ShotSequenceDecoder strict = new ShotSequenceDecoder(ChartingDecoderConfig.builder()
                .withDirectionlessFaults(false)
                .build());

        assertThrows(UnknownCodeException.class,
                () -> strict.decode(A, B, true, "n", "4*"));
    }

    @Test
    void doubleFault()
    {
        ShotSequence seq = decoder.decode(A, B, false, "4n", "5d");

        assertTrue(seq.isDoubleFault());
        assertTrue(seq.rally().isEmpty());
        assertEquals(2, seq.serves().size());
    }

    @Test
    void secondServeReturnedInPlay()
    {
        ShotSequence seq = decoder.decode(A, B, true, "6n", "5b28f1*");

        assertTrue(seq.secondServe().orElseThrow().hadRally());
        Rally rally = seq.rally().orElseThrow();
        assertEquals(2, rally.length());
        assertEquals(B, rally.shots().get(0).player());
        assertEquals(A, rally.lastShot().player());
    }

    // ---------------------------------------------------------------------
    // First serve in
    // ---------------------------------------------------------------------

    @Test
    void outrightAceHasNoRallyAndNoSecondServe()
    {
        ShotSequence seq = decoder.decode(A, B, true, "6*", null);

        assertFalse(seq.firstServe().orElseThrow().hadRally());
        assertTrue(seq.rally().isEmpty());
        assertTrue(seq.secondServe().isEmpty());
        assertTrue(seq.isAce());
    }

    @Test
    void threeShotRallyAlternatesFromTheReturner()
    {
        ShotSequence seq = decoder.decode(A, B, true, "4f1b2f3*", null);

        Rally rally = seq.rally().orElseThrow();
        assertEquals(3, rally.length());
        assertEquals(List.of(B, A, B), rally.shots().stream().map(s -> s.player()).toList());
        assertTrue(seq.secondServe().isEmpty());
    }

    @Test
    void unexpectedSecondServeIsMalformed()
    {
        MalformedSequenceException e = assertThrows(MalformedSequenceException.class,
                () -> decoder.decode(A, B, true, "6*", "4n"));
        assertEquals("4n", e.offendingCode());
    }

    @Test
    void unexpectedSecondServeIgnoredWhenConfigured()
    {
        ShotSequenceDecoder tolerant = new ShotSequenceDecoder(ChartingDecoderConfig.builder()
                .withRejectUnexpectedSecondServe(false)
                .build());

        ShotSequence seq = tolerant.decode(A, B, true, "6*", "4n");
        assertTrue(seq.secondServe().isEmpty());
    }

    @Test
    void blankSecondCodeAfterServeInIsAccepted()
    {
        ShotSequence seq = decoder.decode(A, B, true, "6*", " ");

        assertTrue(seq.secondServe().isEmpty());
    }

    @Test
    void missingFirstCode()
    {
        assertThrows(MissingServeException.class,
                () -> decoder.decode(A, B, true, null, null));
        assertThrows(MissingServeException.class,
                () -> decoder.decode(A, B, true, "   ", null));
    }

    @Test
    void rallyFailureReportsTheFullServeCode()
    {
        UnknownCodeException e = assertThrows(UnknownCodeException.class,
                () -> decoder.decode(A, B, true, "6f1%*", null));
        assertEquals("%", e.offendingCode());
        assertEquals("6f1%*", e.fullCode());
    }

    // ---------------------------------------------------------------------
    // Properties
    // ---------------------------------------------------------------------

    @Test
    void decodingTheSamePairTwiceIsEqual()
    {
        ShotSequence a = decoder.decode(A, B, true, "c4n", "6+f2v1*");
        ShotSequence b = decoder.decode(A, B, true, "c4n", "6+f2v1*");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void terminatingServeHadRallyIffRallyPresent()
    {
        String[][] codes = {
                {"6*", null},
                {"4#", null},
                {"5f1*", null},
                {"4n", "5d"},
                {"w", "6b3f2b1n@"},
                {"6x", "4#"},
        };

        for (String[] pair : codes) {
            ShotSequence seq = decoder.decode(A, B, true, pair[0], pair[1]);
            Serve terminating = seq.terminatingServe().orElseThrow();
            assertEquals(terminating.hadRally(), seq.rally().isPresent(), pair[0]);
            assertFalse(terminating.wasFault() && terminating.isFirst(), pair[0]);
        }
    }

    @Test
    void fromCodeUsesTheDefaultDecoder()
    {
        assertEquals(
                decoder.decode(A, B, true, "4f1b2f3*", null),
                ShotSequence.fromCode(A, B, true, "4f1b2f3*", null));
    }
}
