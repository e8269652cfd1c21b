package com.flamegraphai.service.speedscope;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Validated top level of a speedscope document: the frame table and the
 * still undecoded profile entries.
 */
@Value
@Builder
public class SpeedscopeDocument {
    List<Frame> frames;
    List<Object> profiles;

    public int getFrameCount() {
        return frames.size();
    }

    /**
     * Creates a fresh metrics arena, one slot per frame.
     */
    public FrameMetrics[] newMetricsArena() {
        FrameMetrics[] metrics = new FrameMetrics[frames.size()];
        for (Frame frame : frames) {
            metrics[frame.getIndex()] = new FrameMetrics(frame);
        }
        return metrics;
    }
}
