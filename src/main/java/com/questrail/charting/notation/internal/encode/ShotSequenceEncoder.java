package com.questrail.charting.notation.internal.encode;

import com.questrail.charting.notation.model.Rally;
import com.questrail.charting.notation.model.Serve;
import com.questrail.charting.notation.model.Shot;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.notation.vocabulary.ServeOutcome;
import com.questrail.charting.notation.vocabulary.ShortcutCode;
import com.questrail.charting.notation.vocabulary.ShotDirection;

import java.util.Objects;
import java.util.Optional;

/**
 * ShotSequenceEncoder
 * ============================================================================
 * Converts a {@link ShotSequence} back into the pair of charting codes it
 * would be recorded as.
 *
 * <p>The output is canonical rather than a byte-for-byte copy of whatever was
 * originally decoded: modifiers are written in a fixed order
 * (position, direction, depth, net cord, drop volley, error, outcome) and an
 * unknown shot direction is omitted. Decoding the output produces a sequence
 * with the same serves, shots and outcomes.</p>
 */
public final class ShotSequenceEncoder
{
    /**
     * The two charting columns of one point. {@code secondCode} is
     * {@code null} unless the first serve faulted.
     */
    public record EncodedPoint(String firstCode, String secondCode) {
        public EncodedPoint {
            Objects.requireNonNull(firstCode, "firstCode");
        }

        public Optional<String> second() {
            return Optional.ofNullable(secondCode);
        }
    }

    public EncodedPoint encode(ShotSequence sequence)
    {
        Objects.requireNonNull(sequence, "sequence");

        switch (sequence.shape()) {
            case NOT_CODED:
                return new EncodedPoint(String.valueOf((sequence.serverWon()
                        ? ShortcutCode.SERVER_WON_NOT_CODED
                        : ShortcutCode.RETURNER_WON_NOT_CODED).code()), null);
            case SERVER_LOST_OUTRIGHT:
                return new EncodedPoint(String.valueOf(ShortcutCode.SERVER_PENALTY.code()), null);
            case SERVER_WON_OUTRIGHT:
                return new EncodedPoint(String.valueOf(ShortcutCode.RETURNER_PENALTY.code()), null);
            default:
                break;
        }

        Serve first = sequence.firstServe().orElseThrow();
        Optional<? extends Serve> second = sequence.secondServe();
        String rally = sequence.rally().map(this::encodeRally).orElse("");

        if (second.isEmpty()) {
            return new EncodedPoint(encodeServe(first) + rally, null);
        }
        return new EncodedPoint(encodeServe(first), encodeServe(second.get()) + rally);
    }

    /**
     * Encodes a serve attempt without any rally that followed it.
     */
    public String encodeServe(Serve serve)
    {
        StringBuilder sb = new StringBuilder();
        sb.append("c".repeat(serve.lets()));
        sb.append(serve.direction().code());
        if (serve.serveAndVolley()) {
            sb.append('+');
        }

        if (serve.outcome() == ServeOutcome.FAULT) {
            sb.append(serve.fault().orElseThrow().code());
        }
        else if (serve.outcome().marker() != null) {
            sb.append(serve.outcome().marker().charValue());
        }
        return sb.toString();
    }

    public String encodeRally(Rally rally)
    {
        StringBuilder sb = new StringBuilder();
        for (Shot shot : rally.shots()) {
            sb.append(encodeShot(shot));
        }
        return sb.toString();
    }

    public String encodeShot(Shot shot)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(shot.type().code());
        shot.position().ifPresent(p -> sb.append(p.code()));
        if (shot.direction() != ShotDirection.UNKNOWN) {
            sb.append(shot.direction().code());
        }
        shot.depth().ifPresent(d -> sb.append(d.code()));
        if (shot.netCord()) {
            sb.append(';');
        }
        if (shot.dropVolley()) {
            sb.append('^');
        }
        shot.error().ifPresent(e -> sb.append(e.code()));
        if (shot.outcome().isTerminal()) {
            sb.append(shot.outcome().marker().charValue());
        }
        return sb.toString();
    }
}
