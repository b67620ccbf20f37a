package com.logs.anomaly.engine.feature;

import java.util.Arrays;

/**
 * Dense numeric view of a log batch. Row i belongs to record i of the batch,
 * every row has exactly {@code manifest.size()} columns.
 */
public class FeatureMatrix {

    private final double[][] rows;
    private final ColumnManifest manifest;

    public FeatureMatrix(double[][] rows, ColumnManifest manifest) {
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != manifest.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row %d has %d values, expected %d", i, rows[i].length, manifest.size()));
            }
        }
        this.rows = rows;
        this.manifest = manifest;
    }

    public int rowCount() {
        return rows.length;
    }

    public int columnCount() {
        return manifest.size();
    }

    /**
     * Values of one column across all rows, looked up by name.
     */
    public double[] column(String name) {
        int idx = manifest.indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        double[] values = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            values[i] = rows[i][idx];
        }
        return values;
    }

    public ColumnManifest getManifest() {
        return manifest;
    }

    /** Defensive copy handed to the model. */
    public double[][] toArray() {
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = Arrays.copyOf(rows[i], rows[i].length);
        }
        return copy;
    }
}
