package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.util.Optional;

/**
 * The opening serve of a point. A fault here is followed by a {@link SecondServe}.
 *
 * <p>{@code faultKind} is {@code null} unless {@code outcome} is
 * {@link ServeOutcome#FAULT}; prefer {@link #fault()}.</p>
 */
public record FirstServe(
        Player server,
        String rawCode,
        int lets,
        ServeDirection direction,
        boolean serveAndVolley,
        ServeOutcome outcome,
        FaultKind faultKind
) implements Serve
{
    public FirstServe
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
        return true;
    }
}
