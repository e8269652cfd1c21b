package com.flamegraphai.service.speedscope;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

import static com.flamegraphai.service.speedscope.PayloadValues.asIndex;
import static com.flamegraphai.service.speedscope.PayloadValues.asListOrNull;
import static com.flamegraphai.service.speedscope.PayloadValues.asNumber;
import static com.flamegraphai.service.speedscope.PayloadValues.elementAt;
import static com.flamegraphai.service.speedscope.PayloadValues.requireFinite;

/**
 * Accumulates pre-collapsed stack samples into the metrics arena.
 *
 * <p>A single malformed sample (missing, not a list, or empty) is skipped, as is
 * a sample with a non-positive weight. Bad weights and bad frame references
 * still fail the whole document.
 */
@Component
public class SampledProfileAggregator {

    /**
     * @return the observed weight contributed by this profile entry
     */
    public double aggregate(Map<String, Object> profile, int profileIndex, FrameMetrics[] metrics) {
        List<Object> samples = asListOrNull(profile.get("samples"));
        if (samples == null) {
            throw new SpeedscopeParseException(ParseErrorKind.MALFORMED_DOCUMENT,
                    "Sampled profile " + profileIndex + " is missing samples array");
        }

        List<Object> weights = asListOrNull(profile.get("weights"));
        boolean weighted = weights != null && !weights.isEmpty();
        double observed = 0;

        for (int sampleIndex = 0; sampleIndex < samples.size(); sampleIndex++) {
            List<Object> stack = asListOrNull(samples.get(sampleIndex));
            if (stack == null || stack.isEmpty()) {
                continue;
            }

            double weight = weighted
                    ? asNumber(elementAt(weights, sampleIndex), ParseErrorKind.INVALID_WEIGHT,
                            "Invalid weight at sampled profile " + profileIndex + ", index " + sampleIndex)
                    : 1;
            if (weight <= 0) {
                continue;
            }

            String overflow = "Accumulated weight overflows in sampled profile " + profileIndex
                    + " at sample " + sampleIndex;
            observed = requireFinite(observed + weight, ParseErrorKind.INVALID_WEIGHT, overflow);

            String frameError = "Invalid frame reference in sampled profile " + profileIndex
                    + ", sample " + sampleIndex;
            int leaf = -1;
            for (Object element : stack) {
                leaf = asIndex(element, metrics.length, frameError);
                metrics[leaf].addInclusive(weight);
                requireFinite(metrics[leaf].getTotalTime(), ParseErrorKind.INVALID_WEIGHT, overflow);
            }
            metrics[leaf].addExclusive(weight);
        }

        return observed;
    }
}
