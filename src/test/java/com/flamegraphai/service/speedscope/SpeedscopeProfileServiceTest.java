package com.flamegraphai.service.speedscope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamegraphai.config.FlamegraphProperties;
import com.flamegraphai.model.Hotspot;
import com.flamegraphai.model.ProfileSummary;
import com.flamegraphai.service.hotspot.HotspotRankingService;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.close;
import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.document;
import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.evented;
import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.frame;
import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.open;
import static com.flamegraphai.service.speedscope.SpeedscopeFixtures.sampled;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpeedscopeProfileServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private final SpeedscopeProfileService service = new SpeedscopeProfileService(
            new SpeedscopeDocumentValidator(),
            new SampledProfileAggregator(),
            new EventedProfileReconstructor(),
            new HotspotRankingService(),
            new FlamegraphProperties());

    @Test
    void parsesSampledProfilesAndComputesMetrics() {
        ProfileSummary summary = service.parse(renderDocument());

        assertThat(summary.getTotalSamples()).isEqualTo(14);
        assertThat(summary.getProfileCount()).isEqualTo(1);

        Hotspot root = byName(summary, "root");
        assertThat(root.getInclusivePct()).isEqualTo(100.0);
        assertThat(root.getExclusivePct()).isZero();
        assertThat(byName(summary, "render").getExclusivePct()).isEqualTo(85.71);
        assertThat(byName(summary, "render").getRank()).isEqualTo(1);
    }

    @Test
    void parsesEventedProfilesAndComputesInclusiveAndExclusiveTime() {
        ProfileSummary summary = service.parse(document(
                List.of(frame("main", "main.ts"), frame("work", "work.ts")),
                evented(open(0, 0), open(1, 2), close(1, 6), close(0, 10))));

        assertThat(summary.getTotalSamples()).isEqualTo(10);

        Hotspot main = byName(summary, "main");
        Hotspot work = byName(summary, "work");
        assertThat(main.getTotalTimeMs()).isEqualTo(10.0);
        assertThat(main.getSelfTimeMs()).isEqualTo(6.0);
        assertThat(main.getInclusivePct()).isEqualTo(100.0);
        assertThat(main.getRank()).isEqualTo(1);
        assertThat(work.getTotalTimeMs()).isEqualTo(4.0);
        assertThat(work.getExclusivePct()).isEqualTo(40.0);
    }

    @Test
    void parsesDecodedJsonText() throws Exception {
        String json = "{\"$schema\":\"https://www.speedscope.app/file-format-schema.json\","
                + "\"shared\":{\"frames\":[{\"name\":\"main\",\"file\":\"main.ts\"},{\"name\":\"io\"}]},"
                + "\"profiles\":[{\"type\":\"sampled\",\"samples\":[[0,1],[0]],\"weights\":[1.5,0.5]}]}";

        ProfileSummary summary = service.parse(objectMapper.readValue(json, Object.class));

        assertThat(summary.getTotalSamples()).isEqualTo(2);
        assertThat(byName(summary, "main").getInclusivePct()).isEqualTo(100.0);
        assertThat(byName(summary, "io").getFile()).isEqualTo("unknown");
        assertThat(byName(summary, "io").getExclusivePct()).isEqualTo(75.0);
    }

    @Test
    void accumulatesAcrossProfileEntriesOfBothKinds() {
        ProfileSummary summary = service.parse(document(
                List.of(frame("main", "main.ts"), frame("work", "work.ts")),
                sampled(List.of(List.of(0, 1)), List.of(4)),
                evented(open(0, 0), close(0, 6))));

        assertThat(summary.getProfileCount()).isEqualTo(2);
        assertThat(summary.getTotalSamples()).isEqualTo(10);
        assertThat(byName(summary, "main").getTotalTimeMs()).isEqualTo(10.0);
        assertThat(byName(summary, "main").getSelfTimeMs()).isEqualTo(6.0);
        assertThat(byName(summary, "main").getSampleCount()).isEqualTo(2);
        assertThat(byName(summary, "work").getInclusivePct()).isEqualTo(40.0);
    }

    @Test
    void soleOuterFrameIsAlwaysFullyInclusive() {
        ProfileSummary summary = service.parse(document(
                List.of(frame("main", "main.ts"), frame("a", "a.ts"), frame("b", "b.ts")),
                sampled(List.of(List.of(0, 1), List.of(0, 2, 1), List.of(0)), List.of(3, 7.5, 0.25))));

        assertThat(byName(summary, "main").getInclusivePct()).isEqualTo(100.0);
        summary.getHotspots().forEach(h -> assertThat(h.getTotalTimeMs()).isGreaterThanOrEqualTo(h.getSelfTimeMs()));
    }

    @Test
    void failsWhenNoWeightIsPositive() {
        Map<String, Object> doc = document(List.of(frame("main", "main.ts")),
                sampled(List.of(List.of(0), List.of(0)), List.of(0, -1)));

        assertThatThrownBy(() -> service.parse(doc))
                .isInstanceOf(SpeedscopeParseException.class)
                .extracting("kind").isEqualTo(ParseErrorKind.NO_MEASURABLE_ACTIVITY);
    }

    @Test
    void rejectsObservedTimeOverflowingAcrossProfiles() {
        Map<String, Object> doc = document(List.of(frame("a", "a.ts"), frame("b", "b.ts")),
                sampled(List.of(List.of(0)), List.of(1e308)),
                sampled(List.of(List.of(1)), List.of(1e308)));

        assertThatThrownBy(() -> service.parse(doc))
                .isInstanceOf(SpeedscopeParseException.class)
                .hasMessage("Observed time overflows after profile 1")
                .extracting("kind").isEqualTo(ParseErrorKind.INVALID_WEIGHT);
    }

    @Test
    void rejectsUnsupportedProfileType() {
        Map<String, Object> unknown = new HashMap<>();
        unknown.put("type", "flat");

        assertThatThrownBy(() -> service.parse(document(List.of(frame("main", "main.ts")),
                sampled(List.of(List.of(0)), null), unknown)))
                .isInstanceOf(SpeedscopeParseException.class)
                .hasMessage("Unsupported profile type at index 1: flat")
                .extracting("kind").isEqualTo(ParseErrorKind.UNSUPPORTED_PROFILE_TYPE);

        assertThatThrownBy(() -> service.parse(document(List.of(frame("main", "main.ts")), new HashMap<>())))
                .extracting("kind").isEqualTo(ParseErrorKind.UNSUPPORTED_PROFILE_TYPE);
    }

    @Test
    void rejectsProfileEntryThatIsNotAnObject() {
        assertThatThrownBy(() -> service.parse(document(List.of(frame("main", "main.ts")), List.of(0))))
                .isInstanceOf(SpeedscopeParseException.class)
                .hasMessage("Invalid profile at index 0")
                .extracting("kind").isEqualTo(ParseErrorKind.MALFORMED_DOCUMENT);
    }

    @Test
    void rejectsShortEventStreams() {
        assertThatThrownBy(() -> service.parse(document(List.of(frame("x", "x.ts")), evented(close(0, 10)))))
                .isInstanceOf(SpeedscopeParseException.class)
                .hasMessageMatching(".*at least two events.*");
    }

    @Test
    void firstViolationAbortsTheWholeParse() {
        Map<String, Object> doc = document(List.of(frame("main", "main.ts")),
                sampled(List.of(List.of(0)), null),
                evented(open(0, 0), close(0, 5), open(0, 6)));

        assertThatThrownBy(() -> service.parse(doc))
                .isInstanceOf(SpeedscopeParseException.class)
                .extracting("kind").isEqualTo(ParseErrorKind.UNCLOSED_FRAMES);
    }

    @Test
    void repeatedParsesProduceIdenticalOutput() throws Exception {
        Map<String, Object> doc = document(
                List.of(frame("a", "a.ts"), frame("b", "b.ts"), frame("c", "c.ts"), frame("d", "d.ts")),
                sampled(List.of(List.of(0, 1), List.of(0, 2), List.of(0, 3), List.of(3)), List.of(1, 1, 1, 1)),
                evented(open(2, 0), open(1, 1), close(1, 2), close(2, 3)));

        String first = objectMapper.writeValueAsString(service.parse(doc));
        String second = objectMapper.writeValueAsString(service.parse(doc));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void ranksAreDenseAndOneBased() {
        ProfileSummary summary = service.parse(document(
                List.of(frame("a", "a.ts"), frame("b", "b.ts"), frame("c", "c.ts"), frame("unused", "u.ts")),
                sampled(List.of(List.of(0), List.of(0, 1), List.of(0, 1, 2), List.of(2)), null)));

        assertThat(summary.getHotspots()).extracting(Hotspot::getRank)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 3).boxed().toList());
    }

    @Test
    void companionPredicateRecognizesParseErrors() {
        Throwable parseError = catchParseError(() -> service.parse(List.of()));

        assertThat(SpeedscopeParseException.isParseError(parseError)).isTrue();
        assertThat(SpeedscopeParseException.isParseError(new IllegalStateException("boom"))).isFalse();
    }

    private Throwable catchParseError(Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            return e;
        }
        throw new AssertionError("Expected a parse failure");
    }

    private Map<String, Object> renderDocument() {
        return document(
                List.of(frame("root", "app.ts"), frame("render", "render.ts"), frame("diff", "diff.ts")),
                sampled(List.of(List.of(0, 1), List.of(0, 1), List.of(0, 2), List.of(0, 1)), List.of(5, 3, 2, 4)));
    }

    private Hotspot byName(ProfileSummary summary, String name) {
        return summary.getHotspots().stream()
                .filter(h -> h.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }
}
