package com.flamegraphai.service.speedscope;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static com.flamegraphai.service.speedscope.PayloadValues.asIndex;
import static com.flamegraphai.service.speedscope.PayloadValues.asListOrNull;
import static com.flamegraphai.service.speedscope.PayloadValues.asNumber;
import static com.flamegraphai.service.speedscope.PayloadValues.asRecord;
import static com.flamegraphai.service.speedscope.PayloadValues.asText;
import static com.flamegraphai.service.speedscope.PayloadValues.requireFinite;

/**
 * Replays an open/close event stream and attributes the time between
 * consecutive events to the frames on the call stack.
 *
 * <p>Event {@code i} is applied first and the gap up to event {@code i + 1} is
 * then charged to the resulting stack, so an open or close takes effect for the
 * next interval and never retroactively. Time spent with an empty stack is not
 * attributed to anything.
 */
@Component
public class EventedProfileReconstructor {

    /**
     * @return the observed duration contributed by this profile entry
     */
    public double reconstruct(Map<String, Object> profile, int profileIndex, FrameMetrics[] metrics) {
        List<Object> events = asListOrNull(profile.get("events"));
        if (events == null || events.size() < 2) {
            throw new SpeedscopeParseException(ParseErrorKind.MALFORMED_EVENT_STREAM,
                    "Evented profile " + profileIndex + " must include at least two events");
        }

        // Top of stack is the head of the deque
        Deque<Integer> stack = new ArrayDeque<>();
        double observed = 0;

        for (int i = 0; i < events.size(); i++) {
            Map<String, Object> event = eventAt(events, i, profileIndex);
            String typeValue = asText(event.get("type"), "");
            int frame = asIndex(event.get("frame"), metrics.length,
                    "Invalid event frame at profile " + profileIndex + ", index " + i);
            double at = timestampOf(event, profileIndex, i);

            EventType type = EventType.fromWireValue(typeValue);
            if (type == null) {
                throw new SpeedscopeParseException(ParseErrorKind.INVALID_EVENT_TYPE,
                        "Invalid event type at profile " + profileIndex + ", index " + i + ": " + typeValue);
            }

            switch (type) {
                case OPEN -> stack.push(frame);
                case CLOSE -> {
                    Integer closing = stack.poll();
                    if (closing == null || closing != frame) {
                        throw new SpeedscopeParseException(ParseErrorKind.UNBALANCED_STACK,
                                "Unbalanced event stack in profile " + profileIndex + " at event " + i
                                        + " (expected " + (closing == null ? "none" : closing)
                                        + ", got " + frame + ")");
                    }
                }
            }

            if (i == events.size() - 1) {
                continue;
            }

            double nextAt = timestampOf(eventAt(events, i + 1, profileIndex), profileIndex, i + 1);
            double delta = nextAt - at;

            if (delta < 0) {
                throw new SpeedscopeParseException(ParseErrorKind.NON_MONOTONIC_TIMESTAMPS,
                        "Event timestamps must be non-decreasing in profile " + profileIndex
                                + " (event " + (i + 1) + " at " + nextAt + " precedes " + at + ")");
            }

            if (delta > 0 && !stack.isEmpty()) {
                String overflow = "Event durations overflow in evented profile " + profileIndex + " at event " + i;
                observed = requireFinite(observed + delta, ParseErrorKind.INVALID_TIMESTAMP, overflow);
                for (Integer active : stack) {
                    metrics[active].addInclusive(delta);
                    requireFinite(metrics[active].getTotalTime(), ParseErrorKind.INVALID_TIMESTAMP, overflow);
                }
                metrics[stack.peek()].addExclusive(delta);
            }
        }

        if (!stack.isEmpty()) {
            throw new SpeedscopeParseException(ParseErrorKind.UNCLOSED_FRAMES,
                    "Unclosed frames in evented profile " + profileIndex + ": " + describe(stack));
        }

        return observed;
    }

    private Map<String, Object> eventAt(List<Object> events, int index, int profileIndex) {
        return asRecord(events.get(index), ParseErrorKind.MALFORMED_EVENT_STREAM,
                "Invalid event entry at profile " + profileIndex + ", index " + index);
    }

    private double timestampOf(Map<String, Object> event, int profileIndex, int index) {
        return asNumber(event.get("at"), ParseErrorKind.INVALID_TIMESTAMP,
                "Invalid event timestamp at profile " + profileIndex + ", index " + index);
    }

    private String describe(Deque<Integer> stack) {
        StringBuilder open = new StringBuilder("[");
        Iterator<Integer> bottomUp = stack.descendingIterator();
        while (bottomUp.hasNext()) {
            open.append(bottomUp.next());
            if (bottomUp.hasNext()) {
                open.append(", ");
            }
        }
        return open.append("]").toString();
    }
}
