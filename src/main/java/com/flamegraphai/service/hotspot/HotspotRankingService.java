package com.flamegraphai.service.hotspot;

import com.flamegraphai.model.Hotspot;
import com.flamegraphai.service.speedscope.FrameMetrics;
import com.flamegraphai.service.speedscope.ParseErrorKind;
import com.flamegraphai.service.speedscope.SpeedscopeParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns accumulated frame metrics into ranked hotspots.
 */
@Slf4j
@Service
public class HotspotRankingService {

    // Weights of the composite score, fixed so rankings stay comparable across analyses
    static final double INCLUSIVE_WEIGHT = 0.6;
    static final double EXCLUSIVE_WEIGHT = 0.4;

    public List<Hotspot> rank(FrameMetrics[] metrics, double totalObserved) {
        if (totalObserved <= 0) {
            throw new SpeedscopeParseException(ParseErrorKind.NO_MEASURABLE_ACTIVITY,
                    "Profile contains no measurable samples or durations");
        }

        List<RankedFrame> candidates = new ArrayList<>();
        for (FrameMetrics metric : metrics) {
            if (!metric.isObserved()) {
                continue;
            }

            double inclusivePct = round(metric.getTotalTime() / totalObserved * 100, 2);
            double exclusivePct = round(metric.getSelfTime() / totalObserved * 100, 2);
            double score = inclusivePct * INCLUSIVE_WEIGHT + exclusivePct * EXCLUSIVE_WEIGHT;
            metric.setHotspotScore(score);

            Hotspot hotspot = Hotspot.builder()
                    .name(metric.getFrame().getName())
                    .file(metric.getFrame().getFile())
                    .selfTimeMs(round(metric.getSelfTime(), 3))
                    .totalTimeMs(round(metric.getTotalTime(), 3))
                    .sampleCount(metric.getSampleCount())
                    .inclusivePct(inclusivePct)
                    .exclusivePct(exclusivePct)
                    .build();
            candidates.add(new RankedFrame(metric.getFrame().getIndex(), score, hotspot));
        }

        // Equal scores keep the document's frame order
        candidates.sort(Comparator.comparingDouble(RankedFrame::getScore).reversed()
                .thenComparingInt(RankedFrame::getFrameIndex));

        List<Hotspot> hotspots = new ArrayList<>(candidates.size());
        for (RankedFrame candidate : candidates) {
            Hotspot hotspot = candidate.hotspot;
            hotspot.setRank(hotspots.size() + 1);
            hotspots.add(hotspot);
        }

        log.debug("Ranked {} of {} frames against {} observed", hotspots.size(), metrics.length, totalObserved);
        return hotspots;
    }

    // Rounds the exact binary value, so 1.005 becomes 1.00
    static double round(double value, int scale) {
        return new BigDecimal(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    private static class RankedFrame {
        final int frameIndex;
        final double score;
        final Hotspot hotspot;

        RankedFrame(int frameIndex, double score, Hotspot hotspot) {
            this.frameIndex = frameIndex;
            this.score = score;
            this.hotspot = hotspot;
        }

        int getFrameIndex() {
            return frameIndex;
        }

        double getScore() {
            return score;
        }
    }
}
