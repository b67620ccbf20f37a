package com.logs.anomaly.engine.isolationforest;

import com.logs.anomaly.config.DetectorConfig;
import org.springframework.stereotype.Component;

/**
 * Hands out a new, unfitted {@link AnomalyModel} per call so that no fitted state
 * is ever shared between requests.
 */
@Component
public class AnomalyModelFactory {

    private final DetectorConfig config;

    public AnomalyModelFactory(DetectorConfig config) {
        // fail at startup rather than on every request
        AnomalyModel.validateParameters(config.getContamination(), config.getNumTrees(), config.getMaxSamples());
        this.config = config;
    }

    public AnomalyModel create() {
        return new AnomalyModel(
                config.getContamination(),
                config.getSeed(),
                config.getNumTrees(),
                config.getMaxSamples());
    }
}
