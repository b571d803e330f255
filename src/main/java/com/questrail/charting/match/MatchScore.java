package com.questrail.charting.match;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MatchScore
 * =============================================================================
 * A parsed match score, written from the winner's perspective as in result
 * listings: {@code "6-4 3-6 7-6(5)"}.
 *
 * <h2>Accepted tokens</h2>
 * <ul>
 *   <li>{@code a-b} – a set</li>
 *   <li>{@code a-b(t)} – a set decided by a tiebreak the loser reached {@code t} points in</li>
 *   <li>{@code [a-b]} – a match tiebreak in place of a deciding set</li>
 *   <li>{@code RET}, {@code W/O}, {@code DEF}, {@code ABD} – completion marker, last token only</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * Every set must reach a legal finishing score, except the final set of a
 * match that did not complete. A completed match must have been won on sets by
 * the listed winner. A walkover may have no sets at all.
 */
public final class MatchScore
{
    /**
     * How the match ended.
     */
    public enum Completion
    {
        COMPLETED,
        RETIRED,
        WALKOVER,
        DEFAULTED,
        ABANDONED
    }

    private static final Pattern SET = Pattern.compile("(\\d{1,2})-(\\d{1,2})(?:\\((\\d{1,2})\\))?");
    private static final Pattern MATCH_TIEBREAK = Pattern.compile("\\[(\\d{1,2})-(\\d{1,2})]");

    private final String text;
    private final List<SetScore> sets;
    private final Completion completion;

    private MatchScore(String text, List<SetScore> sets, Completion completion)
    {
        this.text = text;
        this.sets = List.copyOf(sets);
        this.completion = completion;
    }

    /**
     * @throws ScoreFormatException if {@code score} is not a valid match score
     */
    public static MatchScore parse(String score)
    {
        Objects.requireNonNull(score, "score");
        final String text = score.strip();
        if (text.isEmpty()) {
            throw new ScoreFormatException("Score is empty", score);
        }

        String[] tokens = text.split("\\s+");
        List<SetScore> sets = new ArrayList<>();
        Completion completion = Completion.COMPLETED;

        for (int i = 0; i < tokens.length; i++) {
            Completion marker = completionMarker(tokens[i]);
            if (marker != null) {
                if (i != tokens.length - 1) {
                    throw new ScoreFormatException("Completion marker '" + tokens[i] + "' must be last", score);
                }
                completion = marker;
                continue;
            }
            sets.add(parseSet(tokens[i], score));
        }

        validate(sets, completion, score);
        return new MatchScore(text, sets, completion);
    }

    private static Completion completionMarker(String token)
    {
        switch (token.toUpperCase(Locale.ROOT)) {
            case "RET":
            case "RET.":
                return Completion.RETIRED;
            case "W/O":
            case "WO":
                return Completion.WALKOVER;
            case "DEF":
            case "DEF.":
                return Completion.DEFAULTED;
            case "ABD":
            case "ABN":
                return Completion.ABANDONED;
            default:
                return null;
        }
    }

    private static SetScore parseSet(String token, String score)
    {
        Matcher m = SET.matcher(token);
        if (m.matches()) {
            OptionalInt tiebreak = (m.group(3) == null)
                    ? OptionalInt.empty()
                    : OptionalInt.of(Integer.parseInt(m.group(3)));
            return new SetScore(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), tiebreak, false);
        }

        m = MATCH_TIEBREAK.matcher(token);
        if (m.matches()) {
            return new SetScore(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    OptionalInt.empty(), true);
        }

        throw new ScoreFormatException("Unrecognized set '" + token + "'", score);
    }

    private static void validate(List<SetScore> sets, Completion completion, String score)
    {
        if (sets.isEmpty()) {
            if (completion == Completion.WALKOVER) {
                return;
            }
            throw new ScoreFormatException("Score contains no sets", score);
        }

        for (int i = 0; i < sets.size(); i++) {
            SetScore set = sets.get(i);
            boolean last = (i == sets.size() - 1);

            if (set.matchTiebreak() && !last) {
                throw new ScoreFormatException("Match tiebreak must be the final set", score);
            }
            if (set.tiebreakPoints().isPresent() && !set.hadTiebreak()) {
                throw new ScoreFormatException("Tiebreak points on set " + set + " without a tiebreak", score);
            }
            if (!set.isComplete() && !(last && completion != Completion.COMPLETED)) {
                throw new ScoreFormatException("Set " + set + " is not a finished set", score);
            }
        }

        if (completion == Completion.COMPLETED) {
            long won = sets.stream().filter(SetScore::wonByMatchWinner).count();
            if (won <= sets.size() - won) {
                throw new ScoreFormatException("Winner did not win more sets than the loser", score);
            }
        }
    }

    public List<SetScore> sets()
    {
        return sets;
    }

    public Completion completion()
    {
        return completion;
    }

    public boolean isCompleted()
    {
        return completion == Completion.COMPLETED;
    }

    public int setsWonByWinner()
    {
        return (int) sets.stream().filter(SetScore::wonByMatchWinner).count();
    }

    public int setsWonByLoser()
    {
        return (int) sets.stream().filter(s -> s.loserGames() > s.winnerGames()).count();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof MatchScore that)) return false;
        return sets.equals(that.sets) && completion == that.completion;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(sets, completion);
    }

    @Override
    public String toString()
    {
        return text;
    }
}
