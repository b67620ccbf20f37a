package com.logs.anomaly.controller;

import com.logs.anomaly.model.ErrorResponse;
import com.logs.anomaly.service.LogAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@Tag(name = "Analysis", description = "Batch anomaly detection over structured log records")
public class LogAnalysisController {

    private final LogAnalysisService analysisService;

    public LogAnalysisController(LogAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @Operation(summary = "Flag anomalous log records",
            description = "Fits an Isolation Forest on the submitted batch and returns every record " +
                    "with an added `is_anomaly` field (-1 = anomaly, 1 = normal). Numeric fields present " +
                    "in every record and the hour/day-of-week of `timestamp` are used as features.")
    @ApiResponse(responseCode = "200", description = "Annotated records, in input order")
    @ApiResponse(responseCode = "400", description = "Empty batch or malformed log data",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @ApiResponse(responseCode = "500", description = "Unexpected failure",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    @PostMapping(value = "/analyze", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<Map<String, Object>>> analyze(
            @RequestBody(required = false) List<Map<String, Object>> logs) {
        return ResponseEntity.ok(analysisService.analyze(logs));
    }
}
