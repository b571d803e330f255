package com.questrail.charting.match;

/**
 * Indicates that a match score string could not be parsed into a valid
 * {@link MatchScore}.
 *
 * Typical causes:
 * <ul>
 *   <li>A token that is neither a set score nor a completion marker</li>
 *   <li>A set that cannot occur under the scoring rules (e.g. {@code 6-5})</li>
 *   <li>A completed match whose listed winner did not win more sets</li>
 * </ul>
 */
public final class ScoreFormatException extends RuntimeException
{
    private final String score;

    public ScoreFormatException(String message, String score) {
        super(message + " (score: '" + score + "')");
        this.score = score;
    }

    public String score() {
        return score;
    }
}
