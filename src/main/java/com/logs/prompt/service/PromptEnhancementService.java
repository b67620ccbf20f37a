package com.logs.prompt.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.TreeSet;

/**
 * Appends the names of the supplied context keys to a prompt.
 * Context values are never echoed back.
 */
@Service
public class PromptEnhancementService {

    private static final Logger log = LoggerFactory.getLogger(PromptEnhancementService.class);

    public static final String PROMPT_REQUIRED = "Prompt is required";
    public static final String CONTEXT_NOT_OBJECT = "Context must be a JSON object";

    public String enhance(Map<String, Object> request) {
        Object prompt = request == null ? null : request.get("prompt");
        if (!(prompt instanceof String text) || text.isEmpty()) {
            throw new InvalidPromptException(PROMPT_REQUIRED);
        }

        Object context = request.get("context");
        if (context != null && !(context instanceof Map)) {
            throw new InvalidPromptException(CONTEXT_NOT_OBJECT);
        }

        String keys = "none";
        if (context instanceof Map<?, ?> contextMap && !contextMap.isEmpty()) {
            TreeSet<String> sorted = new TreeSet<>();
            contextMap.keySet().forEach(k -> sorted.add(String.valueOf(k)));
            keys = String.join(", ", sorted);
        }

        log.debug("Enhanced prompt of {} chars with context keys [{}]", text.length(), keys);
        return text + "\n\n[context keys: " + keys + "]";
    }
}
