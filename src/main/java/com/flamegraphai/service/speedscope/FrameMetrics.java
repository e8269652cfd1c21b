package com.flamegraphai.service.speedscope;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-frame accumulator for one parse call.
 * totalTime never drops below selfTime because every self contribution
 * is paired with an equal total contribution for the same frame.
 */
@Getter
public class FrameMetrics {

    private final Frame frame;
    private double selfTime;
    private double totalTime;
    private int sampleCount;

    @Setter
    private double hotspotScore;

    public FrameMetrics(Frame frame) {
        this.frame = frame;
    }

    void addInclusive(double time) {
        totalTime += time;
        sampleCount++;
    }

    void addExclusive(double time) {
        selfTime += time;
    }

    public boolean isObserved() {
        return totalTime > 0 || selfTime > 0;
    }
}
