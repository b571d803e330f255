package com.questrail.charting.observability;

/**
 * No-op implementation of ChartingObservabilitySink.
 */
public final class NullObservabilitySink implements ChartingObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPointDecoded(PointDecodedEvent event) {}

    @Override
    public void onPointRejected(PointRejectedEvent event) {}

    @Override
    public void onBatchCompleted(BatchCompletedEvent event) {}
}
