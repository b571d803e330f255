package com.questrail.charting.ingest;

import com.questrail.charting.internal.time.SystemWallClock;
import com.questrail.charting.internal.time.WallClock;
import com.questrail.charting.notation.internal.decode.ChartingDecodeException;
import com.questrail.charting.notation.internal.decode.ShotSequenceDecoder;
import com.questrail.charting.notation.model.ShotSequence;
import com.questrail.charting.observability.BatchCompletedEvent;
import com.questrail.charting.observability.ChartingObservabilitySink;
import com.questrail.charting.observability.NullObservabilitySink;
import com.questrail.charting.observability.PointDecodedEvent;
import com.questrail.charting.observability.PointRejectedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * ChartedPointDecoder
 * ============================================================================
 * Decodes many charted points, isolating failures to the point that caused
 * them.
 *
 * <h2>Failure policy</h2>
 * A {@link ChartingDecodeException} for one row drops that row only. The row
 * is reported to the {@link ChartingObservabilitySink} and listed in the
 * returned {@link DecodeReport}; decoding continues with the next row. Any
 * other exception is a defect and propagates.
 *
 * <h2>Concurrency</h2>
 * Points are independent, so {@link #decodeAll(List, ExecutorService)} may
 * decode them on any number of threads. Results are gathered in input order
 * and sink callbacks for decoded and rejected rows are issued from the calling
 * thread, so the sink need not be thread-safe. If gathering stops early on a
 * defect or an interrupt, rows not yet decoded are cancelled.
 */
public final class ChartedPointDecoder
{
    private final ShotSequenceDecoder decoder;
    private final ChartingObservabilitySink sink;
    private final WallClock clock;

    public ChartedPointDecoder(ShotSequenceDecoder decoder,
                               ChartingObservabilitySink sink,
                               WallClock clock)
    {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ChartedPointDecoder(ShotSequenceDecoder decoder)
    {
        this(decoder, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Decodes a single row.
     *
     * @throws ChartingDecodeException if the row's codes cannot be decoded
     */
    public ShotSequence decode(ChartedPoint point)
    {
        Objects.requireNonNull(point, "point");
        return decoder.decode(point.server(), point.returner(), point.serverWon(),
                point.firstCode(), point.secondCode());
    }

    /**
     * Decodes every row on the calling thread.
     */
    public DecodeReport decodeAll(Iterable<ChartedPoint> points)
    {
        Objects.requireNonNull(points, "points");

        List<ShotSequence> decoded = new ArrayList<>();
        List<RejectedPoint> rejected = new ArrayList<>();

        for (ChartedPoint point : points) {
            try {
                accept(point, decode(point), decoded);
            } catch (ChartingDecodeException e) {
                reject(point, e, rejected);
            }
        }
        return complete(decoded, rejected);
    }

    /**
     * Decodes every row on {@code executor}, waiting for all of them.
     *
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public DecodeReport decodeAll(List<ChartedPoint> points, ExecutorService executor)
            throws InterruptedException
    {
        Objects.requireNonNull(points, "points");
        Objects.requireNonNull(executor, "executor");

        List<Future<ShotSequence>> futures = new ArrayList<>(points.size());
        for (ChartedPoint point : points) {
            futures.add(executor.submit(() -> decode(point)));
        }

        List<ShotSequence> decoded = new ArrayList<>();
        List<RejectedPoint> rejected = new ArrayList<>();

        boolean gathered = false;
        try {
            for (int i = 0; i < futures.size(); i++) {
                ChartedPoint point = points.get(i);
                try {
                    accept(point, futures.get(i).get(), decoded);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof ChartingDecodeException decodeFailure) {
                        reject(point, decodeFailure, rejected);
                    } else if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    } else if (cause instanceof Error error) {
                        throw error;
                    } else {
                        throw new IllegalStateException("Unexpected failure decoding point " + point.pointNumber(), cause);
                    }
                } catch (CancellationException e) {
                    throw new IllegalStateException("Decode of point " + point.pointNumber() + " was cancelled", e);
                }
            }
            gathered = true;
        } finally {
            if (!gathered) {
                cancelAll(futures);
            }
        }
        return complete(decoded, rejected);
    }

    // Futures already done ignore cancel(), so this only stops rows still queued or running.
    private static void cancelAll(List<Future<ShotSequence>> futures)
    {
        for (Future<ShotSequence> future : futures) {
            future.cancel(true);
        }
    }

    private void accept(ChartedPoint point, ShotSequence sequence, List<ShotSequence> decoded)
    {
        decoded.add(sequence);
        sink.onPointDecoded(new PointDecodedEvent(clock.now(), point.matchId(), point.pointNumber(), sequence));
    }

    private void reject(ChartedPoint point, ChartingDecodeException e, List<RejectedPoint> rejected)
    {
        rejected.add(new RejectedPoint(point, e));
        sink.onPointRejected(new PointRejectedEvent(clock.now(), point.matchId(), point.pointNumber(),
                point.firstCode(), point.secondCode(), e));
    }

    private DecodeReport complete(List<ShotSequence> decoded, List<RejectedPoint> rejected)
    {
        sink.onBatchCompleted(new BatchCompletedEvent(clock.now(), decoded.size(), rejected.size()));
        return new DecodeReport(decoded, rejected);
    }
}
