package com.logs.prompt.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Prompt with the context key names appended")
public record EnhanceResponse(
        @Schema(example = "abc\n\n[context keys: a, b]")
        String enhanced) {}
