/**
 * Closed character alphabets of the charting notation.
 *
 * <p>Each enum owns one table and resolves its character through
 * {@code fromCode} (or {@code fromMarker} for outcome markers), which returns empty for characters outside the table.</p>
 */
package com.questrail.charting.notation.vocabulary;
