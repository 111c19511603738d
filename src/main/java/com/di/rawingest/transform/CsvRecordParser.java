package com.di.rawingest.transform;

import com.google.api.services.bigquery.model.TableRow;

import java.util.List;

/**
 * Turns one raw CSV line into a row keyed by the declared column names.
 * <p>
 * Values are matched to names by position. A short line leaves the trailing columns out of the row,
 * a long line has its extra values dropped; neither case is an error. There is no quoting support,
 * so a value containing the delimiter shifts every value after it.
 */
public final class CsvRecordParser {

    public static final String DELIMITER = ",";

    private CsvRecordParser() {
    }

    public static TableRow parse(String line, List<String> fieldNames) {
        String[] values = line.split(DELIMITER, -1);
        TableRow row = new TableRow();
        int n = Math.min(values.length, fieldNames.size());
        for (int i = 0; i < n; i++) {
            row.set(fieldNames.get(i), values[i]);
        }
        return row;
    }
}
