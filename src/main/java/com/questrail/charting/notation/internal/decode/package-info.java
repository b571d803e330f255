/**
 * Charting Notation Decoding
 * =============================================================================
 *
 * <p>Turns the one or two code strings charted for a point into a validated
 * {@link com.questrail.charting.notation.model.ShotSequence}.</p>
 *
 * <pre>
 *   first code, second code
 *        → ShotSequenceDecoder   (shortcuts, fault routing)
 *            → ServeDecoder      (lets, direction, serve-and-volley, outcome)
 *                → RallyDecoder  (one shot per letter, alternating players)
 * </pre>
 *
 * <h2>Errors</h2>
 * <p>Every rejection is a subclass of {@link ChartingDecodeException} and
 * carries both the offending fragment and the full code it came from. Decoders
 * never return partial results.</p>
 *
 * <p>All decoders in this package are stateless and safe to share between
 * threads.</p>
 */
package com.questrail.charting.notation.internal.decode;
