package com.flamegraphai.service.speedscope;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.flamegraphai.service.speedscope.PayloadValues.asListOrNull;
import static com.flamegraphai.service.speedscope.PayloadValues.asRecord;
import static com.flamegraphai.service.speedscope.PayloadValues.asText;

/**
 * Checks the top-level shape of a decoded speedscope document and
 * extracts the shared frame table.
 */
@Component
public class SpeedscopeDocumentValidator {

    public SpeedscopeDocument validate(Object payload) {
        Map<String, Object> root = asRecord(payload, ParseErrorKind.MALFORMED_DOCUMENT,
                "Profile must be a JSON object");
        Map<String, Object> shared = asRecord(root.get("shared"), ParseErrorKind.MALFORMED_DOCUMENT,
                "Profile is missing shared frames");

        List<Object> rawFrames = asListOrNull(shared.get("frames"));
        if (rawFrames == null || rawFrames.isEmpty()) {
            throw new SpeedscopeParseException(ParseErrorKind.MALFORMED_DOCUMENT,
                    "Profile shared.frames must be a non-empty array");
        }

        List<Object> profiles = asListOrNull(root.get("profiles"));
        if (profiles == null || profiles.isEmpty()) {
            throw new SpeedscopeParseException(ParseErrorKind.MALFORMED_DOCUMENT,
                    "Profile must include at least one profile entry");
        }

        List<Frame> frames = new ArrayList<>(rawFrames.size());
        for (int idx = 0; idx < rawFrames.size(); idx++) {
            Map<String, Object> frame = asRecord(rawFrames.get(idx), ParseErrorKind.MALFORMED_DOCUMENT,
                    "Invalid frame entry at index " + idx);
            frames.add(new Frame(idx,
                    asText(frame.get("name"), "frame_" + idx),
                    asText(frame.get("file"), "unknown")));
        }

        return SpeedscopeDocument.builder()
                .frames(List.copyOf(frames))
                .profiles(profiles)
                .build();
    }
}
