package com.questrail.charting.notation.internal.decode;

import com.questrail.charting.api.Player;
import com.questrail.charting.config.ChartingDecoderConfig;
import com.questrail.charting.notation.model.FirstServe;
import com.questrail.charting.notation.model.Rally;
import com.questrail.charting.notation.model.SecondServe;
import com.questrail.charting.notation.model.Serve;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.notation.vocabulary.FaultKind;
import com.questrail.charting.notation.vocabulary.ServeDirection;
import com.questrail.charting.notation.vocabulary.ShortcutCode;

import java.util.Objects;
import java.util.Optional;

/**
 * ShotSequenceDecoder
 * ============================================================================
 * Decodes the pair of codes charted for one point into a {@link ShotSequence}.
 *
 * <h2>Decoding order</h2>
 * <ol>
 *   <li><b>Single-character dispatch.</b> A one-character first code is
 *       either a {@link ShortcutCode} (the point is complete), a bare fault
 *       letter (normalized to an unknown-direction fault) or an error.</li>
 *   <li><b>First serve.</b></li>
 *   <li><b>Fault branch.</b> A faulted first serve requires a second serve
 *       code; an in-play second serve continues into the rally.</li>
 *   <li><b>In-play branch.</b> A first serve in play continues into the rally
 *       directly; no second serve is read.</li>
 * </ol>
 *
 * <p>The decoder is stateless and thread-safe. It either returns a complete
 * sequence or throws a {@link ChartingDecodeException}; no partial result is
 * ever produced.</p>
 */
public final class ShotSequenceDecoder
{
    private static final ShotSequenceDecoder DEFAULT =
            new ShotSequenceDecoder(ChartingDecoderConfig.defaults());

    private final ChartingDecoderConfig config;
    private final ServeDecoder serveDecoder;
    private final RallyDecoder rallyDecoder;

    public ShotSequenceDecoder(ChartingDecoderConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.serveDecoder = new ServeDecoder(config);
        this.rallyDecoder = new RallyDecoder();
    }

    public static ShotSequenceDecoder withDefaults()
    {
        return DEFAULT;
    }

    public ChartingDecoderConfig config()
    {
        return config;
    }

    /**
     * @param firstCode  first serve code or single-character shortcut
     * @param secondCode second serve code, may be {@code null} when the first
     *                   serve did not fault
     * @throws ChartingDecodeException if the codes do not describe a valid point
     */
    public ShotSequence decode(Player server,
                               Player returner,
                               boolean serverWon,
                               String firstCode,
                               String secondCode)
    {
        Objects.requireNonNull(server, "server");
        Objects.requireNonNull(returner, "returner");

        if (server.equals(returner)) {
            throw new MalformedSequenceException(
                    "Server and returner are the same player", server.name(), String.valueOf(firstCode));
        }

        if (firstCode == null || firstCode.isBlank()) {
            throw new MissingServeException("First serve code is missing", String.valueOf(firstCode));
        }

        String first = firstCode.strip();

        if (first.length() == 1) {
            final char single = first.charAt(0);

            Optional<ShortcutCode> shortcut = ShortcutCode.fromCode(single);
            if (shortcut.isPresent()) {
                return shortcutSequence(shortcut.get(), server, returner, serverWon);
            }

            if (config.allowDirectionlessFaults() && FaultKind.isFaultCode(single)) {
                first = ServeDirection.UNKNOWN.code() + first;
            }
            else {
                throw new UnknownCodeException("Unknown single-character code", first, firstCode);
            }
        }

        ServeDecoder.Result firstResult = serveDecoder.decode(first, server, true);
        FirstServe firstServe = (FirstServe) firstResult.serve();

        SecondServe secondServe = null;
        Rally rally = null;

        if (firstServe.wasFault()) {
            if (secondCode == null || secondCode.isBlank()) {
                throw new MissingServeException(
                        "First serve faulted but no second serve code was charted", first);
            }

            ServeDecoder.Result secondResult = serveDecoder.decode(secondCode, server, false);
            secondServe = (SecondServe) secondResult.serve();
            rally = rallyAfter(secondServe, secondResult.remainder(), server, returner);
        }
        else {
            if (config.rejectUnexpectedSecondServe() && secondCode != null && !secondCode.isBlank()) {
                throw new MalformedSequenceException(
                        "Second serve charted although the first serve did not fault",
                        secondCode.strip(), first);
            }
            rally = rallyAfter(firstServe, firstResult.remainder(), server, returner);
        }

        return ShotSequence.coded(server, returner, serverWon, firstServe, secondServe, rally);
    }

    private Rally rallyAfter(Serve serve, String remainder, Player server, Player returner)
    {
        if (!serve.hadRally()) {
            return null;
        }
        return rallyDecoder.decode(remainder, serve.rawCode(), server, returner);
    }

    private static ShotSequence shortcutSequence(ShortcutCode shortcut,
                                                 Player server,
                                                 Player returner,
                                                 boolean serverWon)
    {
        return switch (shortcut.shape()) {
            case NOT_CODED -> ShotSequence.notCoded(server, returner, serverWon);
            case SERVER_LOST_OUTRIGHT -> ShotSequence.serverLostOutright(server, returner, serverWon);
            case SERVER_WON_OUTRIGHT -> ShotSequence.serverWonOutright(server, returner, serverWon);
            case CODED -> throw new IllegalStateException("Shortcut mapped to CODED: " + shortcut);
        };
    }
}
