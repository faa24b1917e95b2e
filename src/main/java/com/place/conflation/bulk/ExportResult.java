package com.place.conflation.bulk;

/**
 * Result of an export.
 *
 * @param rowsWritten number of data rows written (header excluded)
 */
public record ExportResult(long rowsWritten) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + rowsWritten + '}';
    }
}
