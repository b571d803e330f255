package com.questrail.charting.ingest;

import com.questrail.charting.notation.internal.decode.ChartingDecodeException;

/**
 * A charted point that was skipped, together with the reason.
 */
public record RejectedPoint(ChartedPoint point, ChartingDecodeException cause)
{
}
