package com.logs.prompt;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Standalone prompt enrichment service. Reads {@code prompt-enhancer.yml} instead of
 * {@code application.yml} so it can be deployed next to the log analyzer without sharing config.
 */
@SpringBootApplication
public class PromptEnhancerApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(PromptEnhancerApplication.class)
                .properties("spring.config.name=prompt-enhancer")
                .run(args);
    }
}
