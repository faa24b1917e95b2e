package com.place.conflation.bulk;

import com.place.conflation.api.ConflationResult;
import com.place.conflation.core.model.AttributeKind;
import com.place.conflation.core.model.ConflatedPlace;
import com.place.conflation.core.model.MatchedPair;
import com.place.conflation.core.model.ResolvedAttribute;
import com.place.conflation.core.model.RuleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * CSV exporter for conflation results.
 *
 * <p>Golden table, one row per matched place:</p>
 * <pre>
 * place_key,record_id_a,record_id_b,match_kind,name_similarity,address_similarity,best_source,name,name_source,name_status,...
 * a-1|b-7,a-1,b-7,FUZZY,89.66,100.00,PROVIDER_A,Tony's Pizzeria,PROVIDER_A,RESOLVED,...
 * </pre>
 *
 * <p>Decision log, one row per place and attribute:</p>
 * <pre>
 * place_key,attribute,status,winning_provider,winning_value,deciding_rule,trace,audit_notes
 * a-1|b-7,name,RESOLVED,PROVIDER_A,Tony's Pizzeria,business-suffix,completeness:TIE > ... > business-suffix:PREFER_A,
 * </pre>
 */
public class CsvConflationExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvConflationExporter.class);
    private static final int PROGRESS_INTERVAL = 1000;
    private static final String TRACE_SEPARATOR = " > ";
    private static final String NOTE_SEPARATOR = "; ";

    public ExportResult exportGoldenTable(ConflationResult result, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));

        List<String> header = new ArrayList<>(List.of("place_key", "record_id_a", "record_id_b", "match_kind",
                "name_similarity", "address_similarity", "best_source"));
        for (AttributeKind kind : AttributeKind.values()) {
            header.add(kind.getKey());
            header.add(kind.getKey() + "_source");
            header.add(kind.getKey() + "_status");
        }
        pw.println(String.join(",", header));

        long rows = 0;
        long total = result.places().size();
        for (ConflatedPlace place : result.places()) {
            MatchedPair pair = place.pair();
            StringJoiner row = new StringJoiner(",");
            row.add(csvEscape(place.placeKey()))
                    .add(csvEscape(pair.recordA().getRecordId()))
                    .add(csvEscape(pair.recordB().getRecordId()))
                    .add(pair.matchKind().name())
                    .add(formatSimilarity(pair.nameSimilarity()))
                    .add(formatSimilarity(pair.addressSimilarity()))
                    .add(place.bestSource().name());
            for (AttributeKind kind : AttributeKind.values()) {
                ResolvedAttribute decision = place.attribute(kind);
                row.add(csvEscape(decision.winningValue()))
                        .add(decision.winningProvider() != null ? decision.winningProvider().name() : "")
                        .add(decision.status().name());
            }
            pw.println(row);
            rows++;
            if (rows % PROGRESS_INTERVAL == 0) {
                cb.onProgress(rows, total, "Exported " + rows + " places");
            }
        }

        finish(pw, "golden table");
        ExportResult exportResult = new ExportResult(rows);
        cb.onProgress(rows, total, "Export completed");
        log.info("export.goldenTable.completed result={}", exportResult);
        return exportResult;
    }

    public ExportResult exportDecisionLog(ConflationResult result, Writer writer, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        PrintWriter pw = new PrintWriter(new BufferedWriter(writer));
        pw.println("place_key,attribute,status,winning_provider,winning_value,deciding_rule,trace,audit_notes");

        long rows = 0;
        long total = (long) result.places().size() * AttributeKind.values().length;
        for (ConflatedPlace place : result.places()) {
            for (AttributeKind kind : AttributeKind.values()) {
                ResolvedAttribute decision = place.attribute(kind);
                StringJoiner trace = new StringJoiner(TRACE_SEPARATOR);
                for (RuleOutcome outcome : decision.decisionTrace()) {
                    trace.add(outcome.toString());
                }
                String decidingRule = decision.decidingRule();
                pw.printf("%s,%s,%s,%s,%s,%s,%s,%s%n",
                        csvEscape(place.placeKey()),
                        kind.getKey(),
                        decision.status().name(),
                        decision.winningProvider() != null ? decision.winningProvider().name() : "",
                        csvEscape(decision.winningValue()),
                        decidingRule != null ? decidingRule : "",
                        csvEscape(trace.toString()),
                        csvEscape(String.join(NOTE_SEPARATOR, decision.auditNotes())));
                rows++;
                if (rows % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rows, total, "Exported " + rows + " decisions");
                }
            }
        }

        finish(pw, "decision log");
        ExportResult exportResult = new ExportResult(rows);
        cb.onProgress(rows, total, "Export completed");
        log.info("export.decisionLog.completed result={}", exportResult);
        return exportResult;
    }

    private static void finish(PrintWriter pw, String what) {
        pw.flush();
        if (pw.checkError()) {
            log.error("export.failed output={}", what);
            throw new UncheckedIOException(new IOException("Failed to write " + what));
        }
    }

    private static String formatSimilarity(double similarity) {
        return String.format(Locale.ROOT, "%.2f", similarity);
    }

    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
