package com.questrail.charting.notation.vocabulary;

/**
 * PointShape
 * -----------------------------------------------------------------------------
 * The four mutually exclusive ways a charted point can be described.
 *
 * <ul>
 *   <li>{@link #NOT_CODED} – the winner is known but no shots were charted</li>
 *   <li>{@link #SERVER_LOST_OUTRIGHT} – the server lost the point without play</li>
 *   <li>{@link #SERVER_WON_OUTRIGHT} – the server won the point without play</li>
 *   <li>{@link #CODED} – a first serve, and whatever followed it, was charted</li>
 * </ul>
 *
 * Only {@link #CODED} points carry serves and rallies.
 */
public enum PointShape
{
    NOT_CODED,
    SERVER_LOST_OUTRIGHT,
    SERVER_WON_OUTRIGHT,
    CODED;

    public boolean isShortcut()
    {
        return this != CODED;
    }
}
