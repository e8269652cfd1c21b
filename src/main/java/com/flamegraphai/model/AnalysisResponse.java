package com.flamegraphai.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class AnalysisResponse {
    private String profileName;
    private String generatedAt;
    private Summary summary;
    private List<Hotspot> hotspots;

    @Data
    @AllArgsConstructor
    public static class Summary {
        private long totalSamples;
        private int profileCount;
    }
}
