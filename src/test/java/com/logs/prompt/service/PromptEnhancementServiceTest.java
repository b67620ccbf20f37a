package com.logs.prompt.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptEnhancementServiceTest {

    private PromptEnhancementService service;

    @BeforeEach
    void setUp() {
        service = new PromptEnhancementService();
    }

    @Test
    void enhance_sortsContextKeys() {
        String enhanced = service.enhance(Map.of("prompt", "abc", "context", Map.of("b", 1, "a", 2)));

        assertThat(enhanced).isEqualTo("abc\n\n[context keys: a, b]");
    }

    @Test
    void enhance_withoutContext_reportsNone() {
        assertThat(service.enhance(Map.of("prompt", "scan host")))
                .isEqualTo("scan host\n\n[context keys: none]");
        assertThat(service.enhance(Map.of("prompt", "scan host", "context", Map.of())))
                .endsWith("[context keys: none]");
    }

    @Test
    void enhance_nullContext_reportsNone() {
        Map<String, Object> request = new HashMap<>();
        request.put("prompt", "p");
        request.put("context", null);

        assertThat(service.enhance(request)).endsWith("[context keys: none]");
    }

    @Test
    void enhance_neverEchoesContextValues() {
        String enhanced = service.enhance(Map.of("prompt", "p", "context", Map.of("token", "s3cr3t")));

        assertThat(enhanced).contains("token").doesNotContain("s3cr3t");
    }

    @Test
    void enhance_missingOrEmptyPrompt_throws() {
        assertThatThrownBy(() -> service.enhance(null)).hasMessage("Prompt is required");
        assertThatThrownBy(() -> service.enhance(Map.of())).hasMessage("Prompt is required");
        assertThatThrownBy(() -> service.enhance(Map.of("prompt", ""))).hasMessage("Prompt is required");
        assertThatThrownBy(() -> service.enhance(Map.of("prompt", 42)))
                .isInstanceOf(InvalidPromptException.class)
                .hasMessage("Prompt is required");
    }

    @Test
    void enhance_contextNotAnObject_throws() {
        assertThatThrownBy(() -> service.enhance(Map.of("prompt", "p", "context", List.of("a"))))
                .isInstanceOf(InvalidPromptException.class)
                .hasMessage("Context must be a JSON object");
    }
}
