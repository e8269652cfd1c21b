package com.flamegraphai.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamegraphai.model.AnalysisResponse;
import com.flamegraphai.model.ProfileSummary;
import com.flamegraphai.service.speedscope.SpeedscopeParseException;
import com.flamegraphai.service.speedscope.SpeedscopeProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * Upload endpoint for speedscope profiles.
 * Decodes the file and hands the generic JSON tree to the parser.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ProfileAnalysisController {

    private final SpeedscopeProfileService profileService;
    private final ObjectMapper objectMapper;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/api/analyze")
    public ResponseEntity<?> analyze(@RequestParam(value = "file", required = false) MultipartFile file) {
        if (file == null) {
            return badRequest("No file uploaded");
        }

        String contentType = file.getContentType();
        if (contentType == null || !contentType.contains("json")) {
            return badRequest("Expected a JSON file upload");
        }

        log.info("Analyzing profile upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());

        Object payload;
        try {
            payload = objectMapper.readValue(file.getBytes(), Object.class);
        } catch (JsonProcessingException e) {
            return badRequest("Uploaded file is not valid JSON");
        } catch (IOException e) {
            log.error("Error reading uploaded profile", e);
            return ResponseEntity.status(500).body(Map.of("error", "Failed to analyze profile"));
        }

        try {
            ProfileSummary summary = profileService.parse(payload);

            AnalysisResponse response = AnalysisResponse.builder()
                    .profileName(file.getOriginalFilename())
                    .generatedAt(Instant.now().toString())
                    .summary(new AnalysisResponse.Summary(summary.getTotalSamples(), summary.getProfileCount()))
                    .hotspots(summary.getHotspots())
                    .build();

            return ResponseEntity.ok(response);
        } catch (Exception e) {
            if (SpeedscopeParseException.isParseError(e)) {
                log.warn("Rejected profile {}: {}", file.getOriginalFilename(), e.getMessage());
                return badRequest(e.getMessage());
            }

            log.error("Error analyzing profile", e);
            return ResponseEntity.status(500).body(Map.of("error", "Failed to analyze profile"));
        }
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
