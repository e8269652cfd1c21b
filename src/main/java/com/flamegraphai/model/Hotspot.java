package com.flamegraphai.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Hotspot {
    private String name;
    private String file;
    private double selfTimeMs;
    private double totalTimeMs;
    private int sampleCount;
    private double inclusivePct;
    private double exclusivePct;
    private int rank;
}
