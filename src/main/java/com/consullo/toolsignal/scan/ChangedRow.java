package com.consullo.toolsignal.scan;

/**
 * A grid row whose text differs from the cached text of the previous scan.
 *
 * @param row row index
 * @param text text read during this scan (the only read of that row in the scan)
 * @since 1.0
 */
public record ChangedRow(int row, String text) {
}
