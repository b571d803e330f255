package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.internal.decode.ShotSequenceDecoder;
import com.questrail.charting.notation.vocabulary.PointShape;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ShotSequence
 * =============================================================================
 * The point-level narrative of one charted point: who served, who returned, who
 * won, and (for charted points) the serves and rally that decided it.
 *
 * <h2>Point shapes</h2>
 * Every sequence has exactly one {@link PointShape}:
 * <ul>
 *   <li>{@link PointShape#NOT_CODED}, {@link PointShape#SERVER_LOST_OUTRIGHT},
 *       {@link PointShape#SERVER_WON_OUTRIGHT} carry no serves and no rally</li>
 *   <li>{@link PointShape#CODED} always carries a first serve; a second serve
 *       exactly when the first serve faulted; a rally exactly when the serve
 *       that decided the point was returned in play</li>
 * </ul>
 *
 * These rules are checked at construction. A sequence that violates them can
 * not be created, whether it came from the decoder or from the explicit
 * factories below.
 *
 * <h2>Lifecycle</h2>
 * Instances are immutable values. Two sequences decoded from the same codes are
 * {@link #equals(Object) equal}.
 */
public final class ShotSequence
{
    private final Player server;
    private final Player returner;
    private final boolean serverWon;
    private final PointShape shape;
    private final FirstServe firstServe;
    private final SecondServe secondServe;
    private final Rally rally;

    private ShotSequence(Player server,
                         Player returner,
                         boolean serverWon,
                         PointShape shape,
                         FirstServe firstServe,
                         SecondServe secondServe,
                         Rally rally)
    {
        this.server = Objects.requireNonNull(server, "server");
        this.returner = Objects.requireNonNull(returner, "returner");
        this.shape = Objects.requireNonNull(shape, "shape");
        this.serverWon = serverWon;
        this.firstServe = firstServe;
        this.secondServe = secondServe;
        this.rally = rally;

        if (server.equals(returner)) {
            throw new IllegalArgumentException("Server and returner must differ (both " + server + ")");
        }
        if (shape.isShortcut()) {
            if (firstServe != null || secondServe != null || rally != null) {
                throw new IllegalArgumentException(shape + " point must not carry serves or a rally");
            }
        }
        else {
            validateCoded();
        }
    }

    private void validateCoded()
    {
        if (firstServe == null) {
            throw new IllegalArgumentException("A coded point requires a first serve");
        }
        if (!firstServe.server().equals(server)
                || (secondServe != null && !secondServe.server().equals(server))) {
            throw new IllegalArgumentException("Serves must be struck by the point's server " + server);
        }
        if (firstServe.wasFault() != (secondServe != null)) {
            throw new IllegalArgumentException(firstServe.wasFault()
                    ? "First serve faulted but no second serve is present"
                    : "Second serve present although the first serve did not fault");
        }

        Serve terminating = (secondServe != null) ? secondServe : firstServe;
        if (terminating.hadRally() != (rally != null)) {
            throw new IllegalArgumentException(terminating.hadRally()
                    ? "Serve was returned in play but no rally is present"
                    : "Rally present although the serve ended the point (" + terminating.outcome() + ")");
        }
        if (rally != null && !rally.shots().get(0).player().equals(returner)) {
            throw new IllegalArgumentException("The first rally shot must be struck by the returner " + returner);
        }
    }

    // ------------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------------

    /**
     * Decodes a point from its charting codes using the default decoder
     * configuration.
     *
     * @param firstCode  first serve code, or a single-character shortcut
     * @param secondCode second serve code; only consulted when the first serve faulted
     * @throws com.questrail.charting.notation.internal.decode.ChartingDecodeException
     *         if the codes cannot be decoded
     */
    public static ShotSequence fromCode(Player server,
                                        Player returner,
                                        boolean serverWon,
                                        String firstCode,
                                        String secondCode)
    {
        return ShotSequenceDecoder.withDefaults()
                .decode(server, returner, serverWon, firstCode, secondCode);
    }

    public static ShotSequence notCoded(Player server, Player returner, boolean serverWon)
    {
        return new ShotSequence(server, returner, serverWon, PointShape.NOT_CODED, null, null, null);
    }

    /**
     * A {@code P} point. {@code serverWon} is recorded as charted; the shape
     * does not override it.
     */
    public static ShotSequence serverLostOutright(Player server, Player returner, boolean serverWon)
    {
        return new ShotSequence(server, returner, serverWon, PointShape.SERVER_LOST_OUTRIGHT, null, null, null);
    }

    /**
     * A {@code Q} point. {@code serverWon} is recorded as charted; the shape
     * does not override it.
     */
    public static ShotSequence serverWonOutright(Player server, Player returner, boolean serverWon)
    {
        return new ShotSequence(server, returner, serverWon, PointShape.SERVER_WON_OUTRIGHT, null, null, null);
    }

    /**
     * Creates a fully coded point.
     *
     * @param secondServe required iff {@code firstServe} faulted, otherwise {@code null}
     * @param rally       required iff the deciding serve had a rally, otherwise {@code null}
     * @throws IllegalArgumentException if the serves and rally do not form a valid point
     */
    public static ShotSequence coded(Player server,
                                     Player returner,
                                     boolean serverWon,
                                     FirstServe firstServe,
                                     SecondServe secondServe,
                                     Rally rally)
    {
        return new ShotSequence(server, returner, serverWon, PointShape.CODED, firstServe, secondServe, rally);
    }

    // ------------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------------

    public Player server()
    {
        return server;
    }

    public Player returner()
    {
        return returner;
    }

    public boolean serverWon()
    {
        return serverWon;
    }

    public Player winner()
    {
        return serverWon ? server : returner;
    }

    public PointShape shape()
    {
        return shape;
    }

    public boolean notCoded()
    {
        return shape == PointShape.NOT_CODED;
    }

    public boolean serverLostOutright()
    {
        return shape == PointShape.SERVER_LOST_OUTRIGHT;
    }

    public boolean serverWonOutright()
    {
        return shape == PointShape.SERVER_WON_OUTRIGHT;
    }

    public Optional<FirstServe> firstServe()
    {
        return Optional.ofNullable(firstServe);
    }

    public Optional<SecondServe> secondServe()
    {
        return Optional.ofNullable(secondServe);
    }

    public Optional<Rally> rally()
    {
        return Optional.ofNullable(rally);
    }

    /**
     * The serve that decided how the point continued: the second serve when
     * there is one, otherwise the first.
     */
    public Optional<Serve> terminatingServe()
    {
        if (secondServe != null) {
            return Optional.of(secondServe);
        }
        return Optional.ofNullable(firstServe);
    }

    /** All serves of the point in the order they were struck. */
    public List<Serve> serves()
    {
        if (firstServe == null) {
            return Collections.emptyList();
        }
        return (secondServe == null) ? List.of(firstServe) : List.of(firstServe, secondServe);
    }

    public boolean isAce()
    {
        return terminatingServe().map(s -> s.outcome() == ServeOutcome.ACE)
                .orElse(false);
    }

    public boolean isDoubleFault()
    {
        return secondServe != null && secondServe.wasFault();
    }

    /** Number of rally shots after the serve; zero when there was no rally. */
    public int rallyLength()
    {
        return (rally == null) ? 0 : rally.length();
    }

    // ------------------------------------------------------------------------
    // Diagnostics
    // ------------------------------------------------------------------------

    /**
     * Returns the chronological debug dump of this point: the serves, then each
     * rally shot, one line per entry. Shortcut points have no serves or shots
     * and produce no lines.
     */
    public List<String> describeSequence()
    {
        List<String> lines = new ArrayList<>();
        for (Serve serve : serves()) {
            lines.add(serve.toString());
        }
        if (rally != null) {
            for (Shot shot : rally.shots()) {
                lines.add(shot.toString());
            }
        }
        return lines;
    }

    public void printSequence(PrintStream out)
    {
        for (String line : describeSequence()) {
            out.println(line);
        }
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ShotSequence that)) return false;
        return serverWon == that.serverWon
                && server.equals(that.server)
                && returner.equals(that.returner)
                && shape == that.shape
                && Objects.equals(firstServe, that.firstServe)
                && Objects.equals(secondServe, that.secondServe)
                && Objects.equals(rally, that.rally);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(server, returner, serverWon, shape, firstServe, secondServe, rally);
    }

    @Override
    public String toString()
    {
        return "ShotSequence[" + server + " vs " + returner
                + ", " + shape
                + ", serverWon=" + serverWon
                + ", serves=" + serves().size()
                + ", rallyLength=" + rallyLength() + "]";
    }
}
