package com.logs.anomaly.service;

import com.logs.anomaly.config.MetricsConfig;
import com.logs.anomaly.engine.feature.FeatureDeriver;
import com.logs.anomaly.engine.feature.FeatureMatrix;
import com.logs.anomaly.engine.isolationforest.AnomalyModel;
import com.logs.anomaly.engine.isolationforest.AnomalyModelFactory;
import com.logs.anomaly.exception.InputMissingException;
import com.logs.anomaly.exception.LogAnalysisException;
import com.logs.anomaly.model.AnomalyLabel;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orchestrates one analysis request.
 *
 * Flow:
 * 1. Reject an absent or empty batch
 * 2. Derive the feature matrix (timestamp decomposition + numeric column selection)
 * 3. Fit a fresh Isolation Forest on that matrix and label every row
 * 4. Copy each input record and add {@code is_anomaly}, keeping input order
 */
@Service
public class LogAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(LogAnalysisService.class);

    public static final String LABEL_FIELD = "is_anomaly";

    private final FeatureDeriver featureDeriver;
    private final AnomalyModelFactory modelFactory;
    private final MetricsConfig metricsConfig;

    public LogAnalysisService(FeatureDeriver featureDeriver,
                              AnomalyModelFactory modelFactory,
                              MetricsConfig metricsConfig) {
        this.featureDeriver = featureDeriver;
        this.modelFactory = modelFactory;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "logs.analyze", contextualName = "analyze-log-batch")
    public List<Map<String, Object>> analyze(List<Map<String, Object>> batch) {
        if (batch == null || batch.isEmpty()) {
            metricsConfig.recordOutcome("input_missing");
            throw new InputMissingException();
        }

        FeatureMatrix matrix;
        List<AnomalyLabel> labels;
        try {
            matrix = featureDeriver.derive(batch);

            // one model per call; never shared across requests
            AnomalyModel model = modelFactory.create();
            labels = model.fitPredict(matrix);
            log.debug("Decision threshold for batch of {}: {}", batch.size(), model.getThreshold());
        } catch (LogAnalysisException e) {
            metricsConfig.recordOutcome(e.getKind().name().toLowerCase(Locale.ROOT));
            throw e;
        } catch (RuntimeException e) {
            metricsConfig.recordOutcome("internal_error");
            throw e;
        }

        List<Map<String, Object>> annotated = new ArrayList<>(batch.size());
        long anomalies = 0;
        for (int i = 0; i < batch.size(); i++) {
            AnomalyLabel label = labels.get(i);
            if (label == AnomalyLabel.ANOMALY) anomalies++;

            Map<String, Object> record = new LinkedHashMap<>(batch.get(i));
            record.put(LABEL_FIELD, label);
            annotated.add(record);
        }

        metricsConfig.recordAnalysis(batch.size(), matrix.columnCount(), anomalies);
        log.info("Analyzed {} log records over columns {}: {} anomalies",
                batch.size(), matrix.getManifest().names(), anomalies);

        return annotated;
    }
}
