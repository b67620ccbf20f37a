package com.logs.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "detector")
public class DetectorConfig {

    // Expected fraction of outliers per batch; sets the labelling threshold. Must be in (0, 0.5].
    private double contamination = 0.05;

    // Fixed seed so identical batches always get identical labels.
    private long seed = 42;

    // Number of isolation trees per fit.
    private int numTrees = 100;

    // Rows sampled (without replacement) per tree, capped at the batch size.
    private int maxSamples = 256;
}
