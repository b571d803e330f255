package com.questrail.charting.notation.internal.decode;

import com.questrail.charting.api.Player;
import com.questrail.charting.config.ChartingDecoderConfig;
import com.questrail.charting.notation.model.FirstServe;
import com.questrail.charting.notation.model.SecondServe;
import com.questrail.charting.notation.model.Serve;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ServeOutcome;

import java.util.Objects;
import java.util.Optional;

/**
 * ServeDecoder
 * ============================================================================
 * Decodes one serve attempt from the front of a serve code.
 *
 * <h2>Serve grammar</h2>
 * <pre>
 *   serve := 'c'* direction '+'? ( fault | '*' | '#' | rally )
 * </pre>
 * <ul>
 *   <li>{@code c} – one let per occurrence</li>
 *   <li>direction – {@code 4} wide, {@code 5} body, {@code 6} T, {@code 0} unknown</li>
 *   <li>{@code +} – serve-and-volley</li>
 *   <li>fault – one {@link FaultKind} letter, ending the code</li>
 *   <li>{@code *} ace, {@code #} unreturnable, each ending the code</li>
 *   <li>anything else is the rally and is returned unconsumed</li>
 * </ul>
 *
 * <h2>Directionless faults</h2>
 * When the direction is missing and the next character is a fault letter, the
 * serve is read as a fault of {@link ServeDirection#UNKNOWN} direction rather
 * than rejected. {@link ChartingDecoderConfig#allowDirectionlessFaults()}
 * switches this off.
 */
public final class ServeDecoder
{
    /**
     * A decoded serve plus the part of the code left for the rally decoder.
     * {@code remainder} is empty unless the serve was returned in play.
     */
    public record Result(Serve serve, String remainder) {
        public Result {
            Objects.requireNonNull(serve, "serve");
            Objects.requireNonNull(remainder, "remainder");
        }
    }

    private final ChartingDecoderConfig config;

    public ServeDecoder(ChartingDecoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * @param code   serve code, surrounding whitespace ignored
     * @param server the player serving
     * @param first  {@code true} for the first serve of the point
     * @throws ChartingDecodeException if the code is not a valid serve
     */
    public Result decode(String code, Player server, boolean first)
    {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(server, "server");

        final String c = code.strip();
        if (c.isEmpty()) {
            throw new MissingServeException(
                    (first ? "First" : "Second") + " serve code is empty", code);
        }

        int pos = 0;
        int lets = 0;
        while (pos < c.length() && c.charAt(pos) == 'c') {
            lets++;
            pos++;
        }
        if (pos == c.length()) {
            throw new MalformedSequenceException("Serve code contains only lets", c, c);
        }

        final ServeDirection direction;
        final char lead = c.charAt(pos);
        Optional<ServeDirection> placed = ServeDirection.fromCode(lead);
        if (placed.isPresent()) {
            direction = placed.get();
            pos++;
        }
        else if (config.allowDirectionlessFaults() && FaultKind.isFaultCode(lead)) {
            direction = ServeDirection.UNKNOWN;
        }
        else {
            throw new UnknownCodeException(
                    "Serve must begin with a direction digit (0, 4, 5, 6)", String.valueOf(lead), c);
        }

        boolean serveAndVolley = false;
        if (pos < c.length() && c.charAt(pos) == '+') {
            serveAndVolley = true;
            pos++;
        }
        if (pos == c.length()) {
            throw new MalformedSequenceException("Serve code has no outcome", c, c);
        }

        final char o = c.charAt(pos);

        Optional<FaultKind> fault = FaultKind.fromCode(o);
        if (fault.isPresent()) {
            requireEnd(c, pos + 1);
            return new Result(
                    serve(first, server, c, lets, direction, serveAndVolley, ServeOutcome.FAULT, fault.get()),
                    "");
        }

        Optional<ServeOutcome> decided = ServeOutcome.fromMarker(o);
        if (decided.isPresent()) {
            requireEnd(c, pos + 1);
            return new Result(
                    serve(first, server, c, lets, direction, serveAndVolley, decided.get(), null),
                    "");
        }

        return new Result(
                serve(first, server, c, lets, direction, serveAndVolley, ServeOutcome.IN_PLAY, null),
                c.substring(pos));
    }

    private static void requireEnd(String code, int from)
    {
        if (from < code.length()) {
            throw new MalformedSequenceException(
                    "Characters follow a serve that ended the attempt", code.substring(from), code);
        }
    }

    private static Serve serve(boolean first,
                               Player server,
                               String rawCode,
                               int lets,
                               ServeDirection direction,
                               boolean serveAndVolley,
                               ServeOutcome outcome,
                               FaultKind faultKind)
    {
        return first
                ? new FirstServe(server, rawCode, lets, direction, serveAndVolley, outcome, faultKind)
                : new SecondServe(server, rawCode, lets, direction, serveAndVolley, outcome, faultKind);
    }
}
