package com.logs.prompt.controller;

import com.logs.prompt.model.EnhanceResponse;
import com.logs.prompt.service.InvalidPromptException;
import com.logs.prompt.service.PromptEnhancementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "Prompt", description = "Lightweight prompt enrichment")
public class PromptController {

    private static final Logger log = LoggerFactory.getLogger(PromptController.class);

    private final PromptEnhancementService enhancementService;

    public PromptController(PromptEnhancementService enhancementService) {
        this.enhancementService = enhancementService;
    }

    @Operation(summary = "Enhance a prompt",
            description = "Returns the prompt followed by the sorted names of the optional `context` object's keys.")
    @PostMapping("/")
    public ResponseEntity<EnhanceResponse> enhance(@RequestBody(required = false) Map<String, Object> request) {
        return ResponseEntity.ok(new EnhanceResponse(enhancementService.enhance(request)));
    }

    @ExceptionHandler(InvalidPromptException.class)
    public ResponseEntity<Map<String, String>> handleInvalidPrompt(InvalidPromptException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    // an unreadable body carries no usable prompt
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable prompt request: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", PromptEnhancementService.PROMPT_REQUIRED));
    }
}
