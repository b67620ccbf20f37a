package com.logs.anomaly.engine.feature;

import com.logs.anomaly.exception.DataFormatException;
import com.logs.anomaly.exception.InputMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of schema-free log records into a {@link FeatureMatrix}.
 *
 * Stages:
 *   1. Timestamp decomposition: if any record carries {@code timestamp}, each one that does is
 *      parsed and contributes {@code hour} (0-23) and {@code day_of_week} (Monday = 0).
 *   2. Schema inference: a field is a numeric column when every non-null value it takes in the
 *      batch is a JSON number. A numeric column missing from any record rejects the batch.
 *   3. Fallback: with no numeric column at all, a single {@code dummy_feature} = row index.
 *
 * Column order: input columns in first-seen order, then the timestamp-derived columns.
 */
@Component
public class FeatureDeriver {

    private static final Logger log = LoggerFactory.getLogger(FeatureDeriver.class);

    public static final String TIMESTAMP_FIELD = "timestamp";
    public static final String HOUR_COLUMN = "hour";
    public static final String DAY_OF_WEEK_COLUMN = "day_of_week";
    public static final String DUMMY_COLUMN = "dummy_feature";

    public FeatureMatrix derive(List<Map<String, Object>> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new InputMissingException();
        }

        boolean hasTimestamp = batch.stream().anyMatch(r -> r != null && r.containsKey(TIMESTAMP_FIELD));

        LinkedHashMap<String, double[]> columns = inferNumericColumns(batch, hasTimestamp);
        if (hasTimestamp) {
            decomposeTimestamps(batch, columns);
        }
        if (columns.isEmpty()) {
            double[] index = new double[batch.size()];
            for (int i = 0; i < index.length; i++) {
                index[i] = i;
            }
            columns.put(DUMMY_COLUMN, index);
        }

        ColumnManifest manifest = new ColumnManifest(new ArrayList<>(columns.keySet()));
        double[][] rows = new double[batch.size()][manifest.size()];
        int c = 0;
        for (double[] values : columns.values()) {
            for (int r = 0; r < rows.length; r++) {
                rows[r][c] = values[r];
            }
            c++;
        }

        log.debug("Derived {}x{} feature matrix, columns={}", rows.length, manifest.size(), manifest.names());
        return new FeatureMatrix(rows, manifest);
    }

    private LinkedHashMap<String, double[]> inferNumericColumns(List<Map<String, Object>> batch,
                                                               boolean hasTimestamp) {
        // first-seen order of every candidate field; false once a non-numeric value shows up
        LinkedHashMap<String, Boolean> candidates = new LinkedHashMap<>();
        for (int i = 0; i < batch.size(); i++) {
            Map<String, Object> record = batch.get(i);
            if (record == null) {
                throw new DataFormatException("Record " + i + " is null");
            }
            for (Map.Entry<String, Object> field : record.entrySet()) {
                String name = field.getKey();
                if (isReserved(name, hasTimestamp)) {
                    continue;
                }
                Object value = field.getValue();
                boolean numeric = candidates.getOrDefault(name, Boolean.TRUE);
                if (value != null && !(value instanceof Number)) {
                    numeric = false;
                }
                candidates.put(name, numeric);
            }
        }

        LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> candidate : candidates.entrySet()) {
            if (!candidate.getValue()) {
                continue;
            }
            String name = candidate.getKey();
            double[] values = new double[batch.size()];
            boolean seenValue = false;
            int firstMissing = -1;
            for (int i = 0; i < batch.size(); i++) {
                Object value = batch.get(i).get(name);
                if (value == null) {
                    if (firstMissing < 0) firstMissing = i;
                } else {
                    values[i] = ((Number) value).doubleValue();
                    seenValue = true;
                }
            }
            if (!seenValue) {
                // only nulls: carries no numeric type at all
                continue;
            }
            if (firstMissing >= 0) {
                throw new DataFormatException(String.format(
                        "Numeric field '%s' is missing in record %d", name, firstMissing));
            }
            columns.put(name, values);
        }
        return columns;
    }

    private void decomposeTimestamps(List<Map<String, Object>> batch, Map<String, double[]> columns) {
        double[] hours = new double[batch.size()];
        double[] days = new double[batch.size()];
        int firstMissing = -1;

        for (int i = 0; i < batch.size(); i++) {
            Object raw = batch.get(i).get(TIMESTAMP_FIELD);
            if (raw == null) {
                if (firstMissing < 0) firstMissing = i;
                continue;
            }
            if (!(raw instanceof String text)) {
                throw new DataFormatException(String.format(
                        "Field '%s' in record %d is not a date-time string: %s", TIMESTAMP_FIELD, i, raw));
            }
            LocalDateTime parsed;
            try {
                parsed = TimestampParser.parse(text);
            } catch (DateTimeParseException e) {
                throw new DataFormatException(String.format(
                        "Unable to parse field '%s' in record %d: '%s'", TIMESTAMP_FIELD, i, text), e);
            }
            hours[i] = parsed.getHour();
            days[i] = TimestampParser.dayOfWeek(parsed);
        }

        if (firstMissing >= 0) {
            throw new DataFormatException(String.format(
                    "Field '%s' is missing in record %d", TIMESTAMP_FIELD, firstMissing));
        }
        columns.put(HOUR_COLUMN, hours);
        columns.put(DAY_OF_WEEK_COLUMN, days);
    }

    private boolean isReserved(String name, boolean hasTimestamp) {
        if (TIMESTAMP_FIELD.equals(name)) {
            return true;
        }
        return hasTimestamp && (HOUR_COLUMN.equals(name) || DAY_OF_WEEK_COLUMN.equals(name));
    }
}
