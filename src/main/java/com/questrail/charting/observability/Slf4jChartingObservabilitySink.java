package com.questrail.charting.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChartingObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChartingObservabilitySink implements ChartingObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jChartingObservabilitySink.class);

    @Override
    public void onPointDecoded(PointDecodedEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Match {} point {}: {}",
                event.matchId(),
                event.pointNumber(),
                event.sequence());
        }
    }

    @Override
    public void onPointRejected(PointRejectedEvent event) {
        log.warn("Match {} point {} dropped ({}): {}",
            event.matchId(),
            event.pointNumber(),
            event.failureKind(),
            event.cause().getMessage());
    }

    @Override
    public void onBatchCompleted(BatchCompletedEvent event) {
        if (event.rejected() > 0) {
            log.info("Decoded {} of {} charted points, {} dropped",
                event.decoded(), event.total(), event.rejected());
        } else {
            log.info("Decoded {} charted points", event.decoded());
        }
    }
}
