package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.vocabulary.CourtPosition;
import com.questrail.charting.notation.vocabulary.ErrorKind;
import com.questrail.charting.notation.vocabulary.ShotDepth;
import com.questrail.charting.notation.vocabulary.ShotDirection;
import com.questrail.charting.notation.vocabulary.ShotOutcome;
import com.questrail.charting.notation.vocabulary.ShotType;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Shot
 * =============================================================================
 * One hit in a rally.
 *
 * <p>A {@code Shot} is immutable. Only {@link #type()} is mandatory in the
 * notation; every other attribute is either defaulted ({@link #direction()}
 * becomes {@link ShotDirection#UNKNOWN}, {@link #outcome()} becomes
 * {@link ShotOutcome#IN_PLAY}) or optional.</p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>An {@link ErrorKind} is only present on a shot whose outcome is an error</li>
 *   <li>Within a {@link Rally}, only the last shot may have a terminal outcome</li>
 * </ul>
 */
public final class Shot
{
    private final Player player;
    private final ShotType type;
    private final ShotDirection direction;
    private final ShotDepth depth;
    private final CourtPosition position;
    private final boolean netCord;
    private final boolean dropVolley;
    private final ErrorKind error;
    private final ShotOutcome outcome;

    private Shot(Builder b)
    {
        this.player = b.player;
        this.type = b.type;
        this.direction = b.direction;
        this.depth = b.depth;
        this.position = b.position;
        this.netCord = b.netCord;
        this.dropVolley = b.dropVolley;
        this.error = b.error;
        this.outcome = b.outcome;
    }

    public static Builder builder(Player player, ShotType type)
    {
        return new Builder(player, type);
    }

    /** The player who hit this shot. */
    public Player player()
    {
        return player;
    }

    public ShotType type()
    {
        return type;
    }

    public ShotDirection direction()
    {
        return direction;
    }

    public Optional<ShotDepth> depth()
    {
        return Optional.ofNullable(depth);
    }

    public Optional<CourtPosition> position()
    {
        return Optional.ofNullable(position);
    }

    /** Whether the shot clipped the net cord. */
    public boolean netCord()
    {
        return netCord;
    }

    public boolean dropVolley()
    {
        return dropVolley;
    }

    public Optional<ErrorKind> error()
    {
        return Optional.ofNullable(error);
    }

    public ShotOutcome outcome()
    {
        return outcome;
    }

    public boolean isTerminal()
    {
        return outcome.isTerminal();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof Shot that)) return false;
        return netCord == that.netCord
                && dropVolley == that.dropVolley
                && player.equals(that.player)
                && type == that.type
                && direction == that.direction
                && depth == that.depth
                && position == that.position
                && error == that.error
                && outcome == that.outcome;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(player, type, direction, depth, position, netCord, dropVolley, error, outcome);
    }

    @Override
    public String toString()
    {
        StringBuilder sb = new StringBuilder();
        sb.append(player).append(": ").append(label(type));
        if (position != null) {
            sb.append(" (").append(label(position)).append(')');
        }
        if (dropVolley) {
            sb.append(", drop volley");
        }
        sb.append(", ").append(label(direction));
        if (depth != null) {
            sb.append(", ").append(label(depth));
        }
        if (netCord) {
            sb.append(", net cord");
        }
        if (outcome.isTerminal()) {
            sb.append(", ").append(label(outcome));
            if (error != null) {
                sb.append(" (").append(label(error)).append(')');
            }
        }
        return sb.toString();
    }

    private static String label(Enum<?> e)
    {
        return e.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    /**
     * Fluent builder for {@link Shot}. Used by the rally decoder and by callers
     * that construct rallies explicitly.
     */
    public static final class Builder
    {
        private final Player player;
        private final ShotType type;
        private ShotDirection direction = ShotDirection.UNKNOWN;
        private ShotDepth depth;
        private CourtPosition position;
        private boolean netCord;
        private boolean dropVolley;
        private ErrorKind error;
        private ShotOutcome outcome = ShotOutcome.IN_PLAY;

        private Builder(Player player, ShotType type)
        {
            this.player = Objects.requireNonNull(player, "player");
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder direction(ShotDirection direction)
        {
            this.direction = Objects.requireNonNull(direction, "direction");
            return this;
        }

        public Builder depth(ShotDepth depth)
        {
            this.depth = depth;
            return this;
        }

        public Builder position(CourtPosition position)
        {
            this.position = position;
            return this;
        }

        public Builder netCord(boolean netCord)
        {
            this.netCord = netCord;
            return this;
        }

        public Builder dropVolley(boolean dropVolley)
        {
            this.dropVolley = dropVolley;
            return this;
        }

        public Builder error(ErrorKind error)
        {
            this.error = error;
            return this;
        }

        public Builder outcome(ShotOutcome outcome)
        {
            this.outcome = Objects.requireNonNull(outcome, "outcome");
            return this;
        }

        /**
         * @throws IllegalArgumentException if an error kind is set on a shot
         *         whose outcome is not an error
         */
        public Shot build()
        {
            if (error != null && !outcome.isError()) {
                throw new IllegalArgumentException(
                        "Error kind " + error + " requires an error outcome (was " + outcome + ")");
            }
            return new Shot(this);
        }
    }
}
