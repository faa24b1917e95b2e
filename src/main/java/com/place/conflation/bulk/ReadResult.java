package com.place.conflation.bulk;

import com.place.conflation.core.model.PlaceRecord;

import java.util.List;

/**
 * Result of reading provider records.
 *
 * @param records   records that were read successfully, in file order
 * @param totalRows number of data rows seen (header and blank lines excluded)
 * @param errors    rows that could not be turned into a record
 */
public record ReadResult(
        List<PlaceRecord> records,
        long totalRows,
        List<ReadError> errors
) {
    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that could not be read.
     *
     * @param lineNumber the line number in the input (1-based)
     * @param line       the offending line
     * @param message    what was wrong with it
     */
    public record ReadError(long lineNumber, String line, String message) {}

    @Override
    public String toString() {
        return "ReadResult{rows=" + totalRows +
                ", records=" + records.size() +
                ", errors=" + errors.size() + '}';
    }
}
