/**
 * Bulk decoding of charted points.
 *
 * <p>{@link com.questrail.charting.ingest.ChartedPointDecoder} decodes a batch
 * of rows, dropping rows that fail to decode and reporting each one to the
 * configured observability sink.</p>
 */
package com.questrail.charting.ingest;
