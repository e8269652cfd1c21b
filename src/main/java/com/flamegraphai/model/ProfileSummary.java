package com.flamegraphai.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ProfileSummary {
    private List<Hotspot> hotspots;
    private long totalSamples;
    private int profileCount;
}
