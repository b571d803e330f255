package com.questrail.charting.observability;

/**
 * Receives events emitted while charted points are decoded in bulk.
 * Implementations can provide logging, metrics, or data-quality auditing.
 */
public interface ChartingObservabilitySink {
    /**
     * Called after a point decoded successfully.
     * @param event the decoded point
     */
    void onPointDecoded(PointDecodedEvent event);

    /**
     * Called when a point could not be decoded and was skipped.
     * @param event the rejected row and the failure
     */
    void onPointRejected(PointRejectedEvent event);

    /**
     * Called once at the end of a bulk decode.
     * @param event the batch totals
     */
    void onBatchCompleted(BatchCompletedEvent event);
}
