package com.logs.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI logAnalyzerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Log Anomaly Analyzer API")
                        .version("1.0.0")
                        .description(
                                "Stateless batch anomaly detection for structured log records.\n\n" +
                                "**Pipeline (per request):**\n" +
                                "1. Receive a JSON array of log objects via `POST /analyze`\n" +
                                "2. Decompose `timestamp` into `hour` and `day_of_week`\n" +
                                "3. Select the fields that are numeric in every record\n" +
                                "4. Fit a fresh Isolation Forest on the batch and score every record\n" +
                                "5. Return each record with `is_anomaly`: **-1** (anomaly) or **1** (normal)\n\n" +
                                "Anomalies are relative to the other records of the same batch; " +
                                "no model is kept between requests.")
                        .contact(new Contact().name("Log Analysis Team")));
    }
}
