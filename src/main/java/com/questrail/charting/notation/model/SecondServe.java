package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.util.Optional;

/**
 * The serve that follows a first-serve fault. A fault here is a double fault and ends the point.
 *
 * <p>{@code faultKind} is {@code null} unless {@code outcome} is
 * {@link ServeOutcome#FAULT}; prefer {@link #fault()}.</p>
 */
public record SecondServe(
        Player server,
        String rawCode,
        int lets,
        ServeDirection direction,
        boolean serveAndVolley,
        ServeOutcome outcome,
        FaultKind faultKind
) implements Serve
{
    public SecondServe
    {
        ServeChecks.validate(server, rawCode, lets, direction, outcome, faultKind);
    }

    @Override
    public Optional<FaultKind> fault()
    {
        return Optional.ofNullable(faultKind);
    }

    @Override
    public boolean isFirst()
    {
        return false;
    }
}
