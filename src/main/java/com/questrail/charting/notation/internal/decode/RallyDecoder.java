package com.questrail.charting.notation.internal.decode;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.model.Rally;
import com.questrail.charting.notation.model.Shot;
import com.questrail.charting.notation.vocabulary.CourtPosition;
import com.questrail.charting.notation.vocabulary.ErrorKind;
import com.questrail.charting.notation.vocabulary.ShotDepth;
import com.questrail.charting.notation.vocabulary.ShotDirection;
import com.questrail.charting.notation.vocabulary.ShotOutcome;
import com.questrail.charting.notation.vocabulary.ShotType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * RallyDecoder
 * ============================================================================
 * Converts the part of a point code that follows an in-play serve into a
 * {@link Rally}.
 *
 * <h2>Token grammar</h2>
 * <pre>
 *   shot     := type modifier*
 *   modifier := position | direction | depth | ';' | '^' | error | outcome
 * </pre>
 * Each modifier axis may appear at most once per shot, in any order.
 *
 * <h2>Players</h2>
 * The first shot is the return, struck by the returner; players then
 * alternate.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Decide whether a rally should exist (the serve decides that)</li>
 *   <li>Accept an empty code; an in-play serve always has at least a return</li>
 * </ul>
 *
 * The decoder holds no state; decoding the same code twice yields equal rallies.
 */
public final class RallyDecoder
{
    /**
     * Decodes a rally code on its own.
     *
     * @throws ChartingDecodeException if the code is not a valid rally
     */
    public Rally decode(String code, Player server, Player returner)
    {
        return decode(code, code, server, returner);
    }

    Rally decode(String code, String fullCode, Player server, Player returner)
    {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(returner, "returner");

        if (code.isEmpty()) {
            throw new MalformedSequenceException("Rally code is empty", code, fullCode);
        }

        ShotTokenizer tokens = new ShotTokenizer(code, fullCode);
        List<Shot> shots = new ArrayList<>();

        while (tokens.hasNext()) {
            String token = tokens.next();
            Player hitter = (shots.size() % 2 == 0) ? returner : server;

            if (!shots.isEmpty() && shots.get(shots.size() - 1).isTerminal()) {
                throw new MalformedSequenceException(
                        "Shot follows a shot that already ended the point", token, fullCode);
            }
            shots.add(decodeShot(token, fullCode, hitter));
        }
        return new Rally(shots);
    }

    private Shot decodeShot(String token, String fullCode, Player hitter)
    {
        ShotType type = ShotType.fromCode(token.charAt(0))
                .orElseThrow(() -> new UnknownCodeException("Unknown shot type", token, fullCode));

        Shot.Builder shot = Shot.builder(hitter, type);

        boolean directionSeen = false;
        boolean depthSeen = false;
        boolean positionSeen = false;
        boolean netCordSeen = false;
        boolean dropVolleySeen = false;
        ErrorKind error = null;
        ShotOutcome outcome = null;

        for (int i = 1; i < token.length(); i++) {
            final char c = token.charAt(i);

            Optional<ShotDirection> direction = ShotDirection.fromCode(c);
            if (direction.isPresent()) {
                directionSeen = once(directionSeen, "direction", token, fullCode);
                shot.direction(direction.get());
                continue;
            }

            Optional<ShotDepth> depth = ShotDepth.fromCode(c);
            if (depth.isPresent()) {
                depthSeen = once(depthSeen, "depth", token, fullCode);
                shot.depth(depth.get());
                continue;
            }

            Optional<CourtPosition> position = CourtPosition.fromCode(c);
            if (position.isPresent()) {
                positionSeen = once(positionSeen, "court position", token, fullCode);
                shot.position(position.get());
                continue;
            }

            if (c == ';') {
                netCordSeen = once(netCordSeen, "net cord", token, fullCode);
                shot.netCord(true);
                continue;
            }

            if (c == '^') {
                dropVolleySeen = once(dropVolleySeen, "drop volley", token, fullCode);
                shot.dropVolley(true);
                continue;
            }

            Optional<ErrorKind> errorKind = ErrorKind.fromCode(c);
            if (errorKind.isPresent()) {
                once(error != null, "error kind", token, fullCode);
                error = errorKind.get();
                continue;
            }

            Optional<ShotOutcome> marker = ShotOutcome.fromMarker(c);
            if (marker.isPresent()) {
                once(outcome != null, "outcome", token, fullCode);
                outcome = marker.get();
                continue;
            }

            throw new UnknownCodeException(
                    "Unknown shot modifier in '" + token + "'", String.valueOf(c), fullCode);
        }

        if (error != null && (outcome == null || !outcome.isError())) {
            throw new MalformedSequenceException(
                    "Error kind requires a forced (#) or unforced (@) error marker", token, fullCode);
        }

        return shot.error(error)
                .outcome(outcome == null ? ShotOutcome.IN_PLAY : outcome)
                .build();
    }

    private static boolean once(boolean alreadySeen, String axis, String token, String fullCode)
    {
        if (alreadySeen) {
            throw new MalformedSequenceException(
                    "Shot repeats its " + axis, token, fullCode);
        }
        return true;
    }
}
