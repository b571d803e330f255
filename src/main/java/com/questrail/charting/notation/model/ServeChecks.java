package com.questrail.charting.notation.model;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.util.Objects;

final class ServeChecks
{
    private ServeChecks() {}

    static void validate(Player server,
                         String rawCode,
                         int lets,
                         ServeDirection direction,
                         ServeOutcome outcome,
                         FaultKind faultKind)
    {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(rawCode, "rawCode");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(outcome, "outcome");

        if (lets < 0) {
            throw new IllegalArgumentException("lets must be >= 0 (was " + lets + ")");
        }
        if ((faultKind != null) != (outcome == ServeOutcome.FAULT)) {
            throw new IllegalArgumentException(
                    "Fault kind must be present exactly when the outcome is FAULT (outcome="
                            + outcome + ", faultKind=" + faultKind + ")");
        }
    }
}
