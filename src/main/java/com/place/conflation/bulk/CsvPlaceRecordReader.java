package com.place.conflation.bulk;

import com.place.conflation.core.model.PlaceRecord;
import com.place.conflation.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads one provider's places from flat CSV.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * record_id,name,street,city,region,postcode,phone,website,category,confidence
 * a-1,"Tony's Pizzeria",12 Main St,Springfield,IL,62704,(217) 555-0101,https://tonys.example,Pizza,0.92
 * </pre>
 *
 * <p>Columns are matched by header name, in any order. A single {@code address} column may
 * replace the address components; unknown columns are kept as raw attributes. Empty cells are
 * treated as absent values. Rows that cannot be read are reported and skipped.</p>
 */
public class CsvPlaceRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvPlaceRecordReader.class);
    private static final int PROGRESS_INTERVAL = 1000;

    static final String RECORD_ID = "record_id";
    static final String CONFIDENCE = "confidence";

    private final Provider provider;

    public CsvPlaceRecordReader(Provider provider) {
        this.provider = provider;
    }

    public ReadResult read(InputStream input, ProgressCallback callback) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ReadResult read(Reader reader, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<PlaceRecord> records = new ArrayList<>();
        List<ReadResult.ReadError> errors = new ArrayList<>();
        long totalRows = 0;

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                return new ReadResult(List.of(), 0, List.of());
            }
            List<String> header = new ArrayList<>();
            for (String column : parseLine(stripBom(headerLine))) {
                header.add(column.trim().toLowerCase(Locale.ROOT));
            }
            int idColumn = header.indexOf(RECORD_ID);
            if (idColumn < 0) {
                throw new IllegalArgumentException("CSV header has no " + RECORD_ID + " column: " + headerLine);
            }

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                totalRows++;

                try {
                    records.add(toRecord(header, idColumn, parseLine(line)));
                } catch (IllegalArgumentException e) {
                    errors.add(new ReadResult.ReadError(lineNumber, line, e.getMessage()));
                    log.warn("read.error provider={} line={} error={}", provider, lineNumber, e.getMessage());
                }

                if (totalRows % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(totalRows, -1, "Read " + totalRows + " rows");
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + provider.getLabel() + " records", e);
        }

        ReadResult result = new ReadResult(records, totalRows, errors);
        cb.onProgress(totalRows, totalRows, "Read completed");
        log.info("read.completed provider={} result={}", provider, result);
        return result;
    }

    private PlaceRecord toRecord(List<String> header, int idColumn, List<String> fields) {
        if (fields.size() != header.size()) {
            throw new IllegalArgumentException("Expected " + header.size() + " fields but found " + fields.size());
        }
        String recordId = fields.get(idColumn).trim();
        if (recordId.isEmpty()) {
            throw new IllegalArgumentException("Missing " + RECORD_ID);
        }

        PlaceRecord.Builder builder = PlaceRecord.builder()
                .recordId(recordId)
                .provider(provider);
        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i);
            String value = fields.get(i);
            if (i == idColumn || column.isEmpty() || value.isBlank()) {
                continue;
            }
            if (CONFIDENCE.equals(column)) {
                builder.confidence(value.trim());
            } else {
                builder.attribute(column, value);
            }
        }
        return builder.build();
    }

    /**
     * Splits one CSV line, honouring double-quoted fields with {@code ""} escapes.
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated quoted field");
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }
}
