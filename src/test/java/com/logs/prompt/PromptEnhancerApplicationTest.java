package com.logs.prompt;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.PropertySource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the enricher the way its main method does: from prompt-enhancer.yml, not application.yml.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "spring.config.name=prompt-enhancer")
class PromptEnhancerApplicationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ConfigurableEnvironment environment;

    @Test
    void context_readsOwnConfigFile() {
        assertThat(environment.getProperty("spring.application.name")).isEqualTo("prompt-enhancer");
        assertThat(environment.getProperty("detector.contamination")).isNull();

        PropertySource<?> configFile = environment.getPropertySources().stream()
                .filter(source -> source.getName().contains("prompt-enhancer.yml"))
                .findFirst()
                .orElseThrow();
        assertThat(configFile.getProperty("server.port")).hasToString("5005");
    }

    @Test
    void enhance_endToEnd() {
        ResponseEntity<Map> response = restTemplate.postForEntity("/",
                Map.of("prompt", "abc", "context", Map.of("b", 1, "a", 2)), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("enhanced", "abc\n\n[context keys: a, b]");
    }

    @Test
    void enhance_missingPrompt_returns400() {
        ResponseEntity<Map> response = restTemplate.postForEntity("/", Map.of("context", Map.of()), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error", "Prompt is required");
    }

    @Test
    void actuatorHealth_isUp() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/actuator/health", Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).containsEntry("status", "UP");
    }
}
