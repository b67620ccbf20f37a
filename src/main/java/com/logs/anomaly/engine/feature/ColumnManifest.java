package com.logs.anomaly.engine.feature;

import java.util.List;

/**
 * Ordered column names of a {@link FeatureMatrix}; position i names matrix column i.
 */
public record ColumnManifest(List<String> names) {

    public ColumnManifest {
        names = List.copyOf(names);
    }

    public int size() {
        return names.size();
    }

    public int indexOf(String name) {
        return names.indexOf(name);
    }
}
