package com.questrail.charting.match;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.stats.ChartingTally;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * CompletedMatch
 * -----------------------------------------------------------------------------
 * A finished match as handed over by the loading layer: who played, when,
 * where, the final score, and the charted points when the match was charted.
 *
 * <p>Immutable. Built with {@link #builder()}.</p>
 */
public final class CompletedMatch
{
    private final Player p1;
    private final Player p2;
    private final LocalDate date;
    private final Player winner;
    private final String tournamentName;
    private final String surface;
    private final Integer round;
    private final MatchScore score;
    private final List<ShotSequence> points;

    private CompletedMatch(Builder b)
    {
        this.p1 = Objects.requireNonNull(b.p1, "p1");
        this.p2 = Objects.requireNonNull(b.p2, "p2");
        this.date = Objects.requireNonNull(b.date, "date");
        this.winner = Objects.requireNonNull(b.winner, "winner");
        this.tournamentName = Objects.requireNonNull(b.tournamentName, "tournamentName");
        this.score = Objects.requireNonNull(b.score, "score");
        this.surface = b.surface;
        this.round = b.round;
        this.points = List.copyOf(b.points);

        if (p1.equals(p2)) {
            throw new IllegalArgumentException("A match needs two different players (both " + p1 + ")");
        }
        if (!winner.equals(p1) && !winner.equals(p2)) {
            throw new IllegalArgumentException("Winner " + winner + " did not play in this match");
        }
        for (ShotSequence point : points) {
            if (!involves(point.server()) || !involves(point.returner())) {
                throw new IllegalArgumentException(
                        "Point " + point + " involves a player who did not play in this match");
            }
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Player p1()
    {
        return p1;
    }

    public Player p2()
    {
        return p2;
    }

    public LocalDate date()
    {
        return date;
    }

    public Player winner()
    {
        return winner;
    }

    public Player loser()
    {
        return winner.equals(p1) ? p2 : p1;
    }

    public String tournamentName()
    {
        return tournamentName;
    }

    public Optional<String> surface()
    {
        return Optional.ofNullable(surface);
    }

    public Optional<Integer> round()
    {
        return Optional.ofNullable(round);
    }

    public MatchScore score()
    {
        return score;
    }

    /** Charted points in match order; empty when the match was not charted. */
    public List<ShotSequence> points()
    {
        return points;
    }

    public boolean involves(Player player)
    {
        return p1.equals(player) || p2.equals(player);
    }

    public boolean hasAtLeastSets(int count)
    {
        return score.sets().size() >= count;
    }

    /**
     * Shot-level counts over the points served by {@code server}.
     */
    public ChartingTally tally(Player server)
    {
        ChartingTally tally = new ChartingTally();
        for (ShotSequence point : points) {
            if (point.server().equals(server)) {
                tally.add(point);
            }
        }
        return tally;
    }

    public ChartingTally tally()
    {
        return ChartingTally.of(points);
    }

    @Override
    public String toString()
    {
        return "CompletedMatch[" + date + " " + tournamentName + ": " + winner + " d. " + loser() + " " + score + "]";
    }

    public static final class Builder
    {
        private Player p1;
        private Player p2;
        private LocalDate date;
        private Player winner;
        private String tournamentName;
        private String surface;
        private Integer round;
        private MatchScore score;
        private final List<ShotSequence> points = new ArrayList<>();

        private Builder() {}

        public Builder withPlayers(Player p1, Player p2)
        {
            this.p1 = p1;
            this.p2 = p2;
            return this;
        }

        public Builder withDate(LocalDate date)
        {
            this.date = date;
            return this;
        }

        public Builder withWinner(Player winner)
        {
            this.winner = winner;
            return this;
        }

        public Builder withTournament(String tournamentName)
        {
            this.tournamentName = tournamentName;
            return this;
        }

        public Builder withSurface(String surface)
        {
            this.surface = surface;
            return this;
        }

        public Builder withRound(int round)
        {
            this.round = round;
            return this;
        }

        public Builder withScore(MatchScore score)
        {
            this.score = score;
            return this;
        }

        /**
         * @throws ScoreFormatException if {@code score} does not parse
         */
        public Builder withScore(String score)
        {
            this.score = MatchScore.parse(score);
            return this;
        }

        public Builder addPoint(ShotSequence point)
        {
            this.points.add(Objects.requireNonNull(point, "point"));
            return this;
        }

        public Builder addPoints(Iterable<ShotSequence> points)
        {
            for (ShotSequence point : points) {
                addPoint(point);
            }
            return this;
        }

        public CompletedMatch build()
        {
            return new CompletedMatch(this);
        }
    }
}
