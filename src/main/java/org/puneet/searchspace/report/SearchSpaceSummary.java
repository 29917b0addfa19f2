package org.puneet.searchspace.report;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.puneet.searchspace.core.SearchSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tabular rendering of {@link SearchSpace#summaryTable()}, as CSV or as an aligned
 * text table for logs.
 *
 * @author Puneet Chandna
 * @version 1.0.0
 * @since 2025-09-02
 */
public final class SearchSpaceSummary {

    private static final Logger logger = LoggerFactory.getLogger(SearchSpaceSummary.class);

    private static final String COLUMN_SEPARATOR = "  ";

    private SearchSpaceSummary() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Writes the summary as CSV with a header row. Nothing is written for a space
     * without parameters.
     *
     * @param searchSpace the space to summarize
     * @param out destination of the CSV text
     * @throws IOException if writing fails
     */
    public static void writeCsv(SearchSpace searchSpace, Appendable out) throws IOException {
        List<Map<String, Object>> rows = searchSpace.summaryTable();
        if (rows.isEmpty()) {
            logger.debug("Search space has no parameters, nothing to write");
            return;
        }
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        CSVFormat format = CSVFormat.DEFAULT
            .withHeader(columns.toArray(new String[0]))
            .withRecordSeparator("\n");

        // the caller owns the destination, so the printer is flushed but not closed
        CSVPrinter printer = new CSVPrinter(out, format);
        for (Map<String, Object> row : rows) {
            List<Object> record = new ArrayList<>();
            for (String column : columns) {
                record.add(row.get(column));
            }
            printer.printRecord(record);
        }
        printer.flush();
        logger.debug("Wrote summary of {} parameters with columns {}", rows.size(), columns);
    }

    /**
     * Aligned text table of the summary, one line per parameter below a header and a
     * separator line.
     *
     * @param searchSpace the space to summarize
     * @return the table, or an empty string for a space without parameters
     */
    public static String format(SearchSpace searchSpace) {
        List<Map<String, Object>> rows = searchSpace.summaryTable();
        if (rows.isEmpty()) {
            return "";
        }
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        int[] widths = new int[columns.size()];
        for (int c = 0; c < columns.size(); c++) {
            widths[c] = columns.get(c).length();
            for (Map<String, Object> row : rows) {
                widths[c] = Math.max(widths[c], String.valueOf(row.get(columns.get(c))).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, new ArrayList<Object>(columns), widths);
        List<Object> separators = new ArrayList<>();
        for (int width : widths) {
            separators.add("-".repeat(width));
        }
        appendLine(sb, separators, widths);
        for (Map<String, Object> row : rows) {
            List<Object> cells = new ArrayList<>();
            for (String column : columns) {
                cells.add(row.get(column));
            }
            appendLine(sb, cells, widths);
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<Object> cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int c = 0; c < cells.size(); c++) {
            if (c > 0) {
                line.append(COLUMN_SEPARATOR);
            }
            line.append(String.format("%-" + widths[c] + "s", cells.get(c)));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }
}
