package com.questrail.charting.stats;

import com.questrail.charting.notation.model.Rally;
import com.questrail.charting.notation.model.Serve;
import com.questrail.charting.notation.model.Shot;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.notation.vocabulary.ServeOutcome;
import com.questrail.charting.notation.vocabulary.ShotOutcome;
import com.questrail.charting.notation.vocabulary.ShotType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * ChartingTally
 * -----------------------------------------------------------------------------
 * Running shot-level counts over decoded points.
 *
 * <p>Counts are taken from the structural accessors of {@link ShotSequence}
 * and {@link Serve}; the tally never looks at notation codes. Points that were
 * not charted, or decided by a penalty, only increase {@link #points()} and
 * their own counter.</p>
 *
 * <p>Not thread-safe. Build one tally per thread and {@link #merge} them.</p>
 */
public final class ChartingTally
{
    private int points;
    private int notCoded;
    private int outright;
    private int firstServesPlayed;
    private int firstServesIn;
    private int aces;
    private int serviceWinners;
    private int doubleFaults;
    private int winners;
    private int forcedErrors;
    private int unforcedErrors;
    private final Map<Integer, Integer> rallyLengths = new TreeMap<>();
    private final Map<ShotType, Integer> shotTypes = new EnumMap<>(ShotType.class);

    public static ChartingTally of(Iterable<ShotSequence> sequences)
    {
        ChartingTally tally = new ChartingTally();
        for (ShotSequence sequence : sequences) {
            tally.add(sequence);
        }
        return tally;
    }

    public ChartingTally add(ShotSequence sequence)
    {
        Objects.requireNonNull(sequence, "sequence");
        points++;

        switch (sequence.shape()) {
            case NOT_CODED -> notCoded++;
            case SERVER_LOST_OUTRIGHT, SERVER_WON_OUTRIGHT -> outright++;
            case CODED -> addCoded(sequence);
        }
        return this;
    }

    private void addCoded(ShotSequence sequence)
    {
        Serve first = sequence.firstServe().orElseThrow();
        firstServesPlayed++;
        if (!first.wasFault()) {
            firstServesIn++;
        }
        if (sequence.isDoubleFault()) {
            doubleFaults++;
        }

        Serve terminating = sequence.terminatingServe().orElseThrow();
        if (terminating.outcome() == ServeOutcome.ACE) {
            aces++;
        } else if (terminating.outcome() == ServeOutcome.SERVICE_WINNER) {
            serviceWinners++;
        }

        rallyLengths.merge(sequence.rallyLength(), 1, Integer::sum);
        sequence.rally().ifPresent(this::addRally);
    }

    private void addRally(Rally rally)
    {
        for (Shot shot : rally.shots()) {
            shotTypes.merge(shot.type(), 1, Integer::sum);
        }

        ShotOutcome last = rally.lastShot().outcome();
        switch (last) {
            case WINNER -> winners++;
            case FORCED_ERROR -> forcedErrors++;
            case UNFORCED_ERROR -> unforcedErrors++;
            case IN_PLAY -> { }
        }
    }

    /**
     * Adds every count of {@code other} into this tally.
     */
    public ChartingTally merge(ChartingTally other)
    {
        Objects.requireNonNull(other, "other");
        points += other.points;
        notCoded += other.notCoded;
        outright += other.outright;
        firstServesPlayed += other.firstServesPlayed;
        firstServesIn += other.firstServesIn;
        aces += other.aces;
        serviceWinners += other.serviceWinners;
        doubleFaults += other.doubleFaults;
        winners += other.winners;
        forcedErrors += other.forcedErrors;
        unforcedErrors += other.unforcedErrors;
        other.rallyLengths.forEach((k, v) -> rallyLengths.merge(k, v, Integer::sum));
        other.shotTypes.forEach((k, v) -> shotTypes.merge(k, v, Integer::sum));
        return this;
    }

    public int points() { return points; }

    public int notCoded() { return notCoded; }

    /** Points decided by a penalty shortcut. */
    public int outright() { return outright; }

    public int firstServesPlayed() { return firstServesPlayed; }

    public int firstServesIn() { return firstServesIn; }

    public int aces() { return aces; }

    public int serviceWinners() { return serviceWinners; }

    public int doubleFaults() { return doubleFaults; }

    /** Rallies that ended with a winner. */
    public int winners() { return winners; }

    public int forcedErrors() { return forcedErrors; }

    public int unforcedErrors() { return unforcedErrors; }

    /**
     * Fraction of first serves that landed in, or {@code NaN} when no first
     * serve was charted.
     */
    public double firstServePercentage()
    {
        return firstServesPlayed == 0 ? Double.NaN : (double) firstServesIn / firstServesPlayed;
    }

    /**
     * Number of coded points per rally length, ascending. Points without a
     * rally are counted under length 0.
     */
    public Map<Integer, Integer> rallyLengths()
    {
        return Collections.unmodifiableMap(rallyLengths);
    }

    public Map<ShotType, Integer> shotTypes()
    {
        return Collections.unmodifiableMap(shotTypes);
    }

    public int shotCount(ShotType type)
    {
        return shotTypes.getOrDefault(type, 0);
    }
}
