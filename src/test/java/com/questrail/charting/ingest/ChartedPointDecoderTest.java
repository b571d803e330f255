package com.questrail.charting.ingest;

import com.questrail.charting.api.Player;
import com.questrail.charting.notation.internal.decode.MalformedSequenceException;
import com.questrail.charting.notation.internal.decode.MissingServeException;
import com.questrail.charting.notation.internal.decode.ShotSequenceDecoder;
import com.questrail.charting.notation.internal.decode.UnknownCodeException;
import com.questrail.charting.observability.BatchCompletedEvent;
import com.questrail.charting.observability.ChartingObservabilitySink;
import com.questrail.charting.observability.PointDecodedEvent;
import com.questrail.charting.observability.PointRejectedEvent;
import com.questrail.charting.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ChartedPointDecoderTest
{
    private static final Player FEDERER = Player.of("Roger Federer");
    private static final Player NADAL = Player.of("Rafael Nadal");
    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private RecordingObservabilitySink sink;
    private ChartedPointDecoder decoder;
    private ExecutorService executor;

    @BeforeEach
    void setUp()
    {
        sink = new RecordingObservabilitySink();
        decoder = new ChartedPointDecoder(ShotSequenceDecoder.withDefaults(), sink, () -> NOW);
    }

    @AfterEach
    void tearDown() throws InterruptedException
    {
        if (executor != null) {
            executor.shutdownNow();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private static ChartedPoint point(int number, String first, String second)
    {
        Player server = (number % 2 == 1) ? FEDERER : NADAL;
        Player returner = (server == FEDERER) ? NADAL : FEDERER;
        return new ChartedPoint("20080706-M-Wimbledon-F", number, server, returner, true, first, second);
    }

    @Test
    void failingRowsAreSkippedAndReported()
    {
        List<ChartedPoint> points = List.of(
                point(1, "6*", null),
                point(2, "Z", null),
                point(3, "4n", "5d"),
                point(4, "6n", null));

        DecodeReport report = decoder.decodeAll(points);

        assertEquals(2, report.decoded().size());
        assertEquals(2, report.rejected().size());
        assertEquals(4, report.total());
        assertTrue(report.hasRejections());

        assertEquals(2, report.rejected().get(0).point().pointNumber());
        assertInstanceOf(UnknownCodeException.class, report.rejected().get(0).cause());
        assertInstanceOf(MissingServeException.class, report.rejected().get(1).cause());
        assertTrue(report.decoded().get(1).isDoubleFault());
    }

    @Test
    void everyRowIsReportedToTheSink()
    {
        decoder.decodeAll(List.of(point(1, "6*", null), point(2, "Z", null)));

        List<PointDecodedEvent> decoded = sink.getEventsOfType(PointDecodedEvent.class);
        List<PointRejectedEvent> rejected = sink.getEventsOfType(PointRejectedEvent.class);
        List<BatchCompletedEvent> batches = sink.getEventsOfType(BatchCompletedEvent.class);

        assertEquals(1, decoded.size());
        assertEquals(1, decoded.get(0).pointNumber());
        assertEquals(NOW, decoded.get(0).timestamp());

        assertEquals(1, rejected.size());
        assertEquals("Z", rejected.get(0).firstCode());
        assertEquals("UnknownCodeException", rejected.get(0).failureKind());

        assertEquals(1, batches.size());
        assertEquals(1, batches.get(0).decoded());
        assertEquals(1, batches.get(0).rejected());
        assertInstanceOf(BatchCompletedEvent.class, sink.getAllEvents().get(2));
    }

    @Test
    void singleRowDecodePropagatesFailures()
    {
        assertThrows(UnknownCodeException.class, () -> decoder.decode(point(1, "Z", null)));
    }

    @Test
    void parallelDecodeMatchesSequentialDecodeInOrder() throws InterruptedException
    {
        String[][] codes = {
                {"6*", null}, {"4f1b2f3*", null}, {"n", "5b28f1*"}, {"X", null},
                {"S", null}, {"4n", "5d"}, {"6+f2v1*", null}, {"5f1%", null},
        };
        List<ChartedPoint> points = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            String[] pair = codes[i % codes.length];
            points.add(point(i + 1, pair[0], pair[1]));
        }

        executor = Executors.newFixedThreadPool(4);
        DecodeReport parallel = decoder.decodeAll(points, executor);
        DecodeReport sequential = new ChartedPointDecoder(ShotSequenceDecoder.withDefaults()).decodeAll(points);

        assertEquals(sequential.decoded(), parallel.decoded());
        assertEquals(50, parallel.rejected().size());
        for (int i = 0; i < parallel.rejected().size(); i++) {
            assertEquals(sequential.rejected().get(i).point(), parallel.rejected().get(i).point());
        }
    }

    @Test
    void rowWithTheSamePlayerOnBothSidesIsSkipped()
    {
        List<ChartedPoint> points = List.of(
                point(1, "6*", null),
                new ChartedPoint("20080706-M-Wimbledon-F", 2, FEDERER, FEDERER, true, "S", null),
                point(3, "4*", null));

        DecodeReport report = decoder.decodeAll(points);

        assertEquals(2, report.decoded().size());
        assertEquals(1, report.rejected().size());
        assertEquals(2, report.rejected().get(0).point().pointNumber());
        assertInstanceOf(MalformedSequenceException.class, report.rejected().get(0).cause());
        assertEquals(NADAL, report.decoded().get(0).returner());
        assertEquals(NADAL, report.decoded().get(1).returner());
    }

    @Test
    void unfinishedRowsAreCancelledWhenGatheringFails()
    {
        ChartingObservabilitySink failingSink = new ChartingObservabilitySink() {
            @Override
            public void onPointDecoded(PointDecodedEvent event) {
                throw new IllegalStateException("sink unavailable");
            }

            @Override
            public void onPointRejected(PointRejectedEvent event) {
            }

            @Override
            public void onBatchCompleted(BatchCompletedEvent event) {
            }
        };
        ChartedPointDecoder failing = new ChartedPointDecoder(ShotSequenceDecoder.withDefaults(), failingSink, () -> NOW);
        FirstTaskOnlyExecutor held = new FirstTaskOnlyExecutor();

        assertThrows(IllegalStateException.class, () -> failing.decodeAll(
                List.of(point(1, "6*", null), point(2, "4*", null), point(3, "5*", null)), held));

        assertEquals(2, held.queued.size());
        for (Runnable task : held.queued) {
            assertTrue(((Future<?>) task).isCancelled());
        }
    }

    /**
     * Runs the first submitted task inline and holds every later one, so the
     * later futures are still pending when gathering stops.
     */
    private static final class FirstTaskOnlyExecutor extends AbstractExecutorService
    {
        private final List<Runnable> queued = new ArrayList<>();
        private boolean ranFirst;

        @Override
        public void execute(Runnable command)
        {
            if (!ranFirst) {
                ranFirst = true;
                command.run();
            } else {
                queued.add(command);
            }
        }

        @Override
        public void shutdown()
        {
        }

        @Override
        public List<Runnable> shutdownNow()
        {
            return List.copyOf(queued);
        }

        @Override
        public boolean isShutdown()
        {
            return false;
        }

        @Override
        public boolean isTerminated()
        {
            return false;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit)
        {
            return true;
        }
    }
}
