package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.util.Optional;

/**
 * Serve
 * =============================================================================
 * Common capability of the two serve attempts a point may contain.
 *
 * <h2>Two-phase serve model</h2>
 * <p>
 * A point starts with a {@link FirstServe}. If, and only if, that serve is a
 * fault the point continues with a {@link SecondServe}. The two are distinct
 * types so that callers branch on {@link #isFirst()} or on the concrete type
 * rather than on a nullable field.
 * </p>
 *
 * <h2>Fault vs. rally</h2>
 * <ul>
 *   <li>{@link #wasFault()} is {@code true} exactly when {@link #fault()} is present</li>
 *   <li>{@link #hadRally()} is {@code true} only for {@link ServeOutcome#IN_PLAY};
 *       aces and service winners put the ball in play yet end the point</li>
 * </ul>
 */
public sealed interface Serve permits FirstServe, SecondServe
{
    Player server();

    /**
     * The serve code as it was decoded, retained for diagnostics. For an
     * in-play serve this includes the rally that followed it.
     */
    String rawCode();

    /** Number of lets called before this serve. */
    int lets();

    ServeDirection direction();

    boolean serveAndVolley();

    ServeOutcome outcome();

    Optional<FaultKind> fault();

    boolean isFirst();

    default boolean wasFault()
    {
        return outcome() == ServeOutcome.FAULT;
    }

    default boolean hadRally()
    {
        return outcome() == ServeOutcome.IN_PLAY;
    }

    /**
     * Whether this serve decided the point by itself: an ace, a service winner,
     * or a fault on the second serve.
     */
    default boolean endedPoint()
    {
        return outcome().endsPointOnServe() || (wasFault() && !isFirst());
    }
}
