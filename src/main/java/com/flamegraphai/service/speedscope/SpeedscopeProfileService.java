package com.flamegraphai.service.speedscope;

import com.flamegraphai.config.FlamegraphProperties;
import com.flamegraphai.model.Hotspot;
import com.flamegraphai.model.ProfileSummary;
import com.flamegraphai.service.hotspot.HotspotRankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.flamegraphai.service.speedscope.PayloadValues.asRecord;
import static com.flamegraphai.service.speedscope.PayloadValues.asText;
import static com.flamegraphai.service.speedscope.PayloadValues.requireFinite;

/**
 * Entry point of the speedscope pipeline: validate, accumulate every profile
 * entry into one metrics arena, then rank.
 *
 * <p>Each call owns its frame table and arena, so the service is safe to share
 * between request threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpeedscopeProfileService {

    private final SpeedscopeDocumentValidator validator;
    private final SampledProfileAggregator sampledAggregator;
    private final EventedProfileReconstructor eventedReconstructor;
    private final HotspotRankingService rankingService;
    private final FlamegraphProperties properties;

    public ProfileSummary parse(Object payload) {
        SpeedscopeDocument document = validator.validate(payload);
        FrameMetrics[] metrics = document.newMetricsArena();
        List<Object> profiles = document.getProfiles();

        double totalObserved = 0;
        for (int profileIndex = 0; profileIndex < profiles.size(); profileIndex++) {
            Map<String, Object> profile = asRecord(profiles.get(profileIndex), ParseErrorKind.MALFORMED_DOCUMENT,
                    "Invalid profile at index " + profileIndex);
            String typeValue = asText(profile.get("type"), "");
            ProfileType type = ProfileType.fromWireValue(typeValue);

            if (type == null) {
                throw new SpeedscopeParseException(ParseErrorKind.UNSUPPORTED_PROFILE_TYPE,
                        "Unsupported profile type at index " + profileIndex + ": " + typeValue);
            }

            double observed = switch (type) {
                case SAMPLED -> sampledAggregator.aggregate(profile, profileIndex, metrics);
                case EVENTED -> eventedReconstructor.reconstruct(profile, profileIndex, metrics);
            };
            log.debug("Profile {} ({}) contributed {}", profileIndex, type.getWireValue(), observed);
            totalObserved = requireFinite(totalObserved + observed,
                    type == ProfileType.SAMPLED ? ParseErrorKind.INVALID_WEIGHT : ParseErrorKind.INVALID_TIMESTAMP,
                    "Observed time overflows after profile " + profileIndex);
        }

        List<Hotspot> hotspots = rankingService.rank(metrics, totalObserved);

        log.info("Parsed speedscope document: {} profiles, {} frames, {} hotspots, {} observed",
                profiles.size(), document.getFrameCount(), hotspots.size(), totalObserved);
        if (log.isDebugEnabled()) {
            hotspots.stream()
                    .limit(properties.getLoggedHotspots())
                    .forEach(h -> log.debug("  #{} {} ({}) incl={}% excl={}%",
                            h.getRank(), h.getName(), h.getFile(), h.getInclusivePct(), h.getExclusivePct()));
        }

        return ProfileSummary.builder()
                .hotspots(hotspots)
                .totalSamples(Math.round(totalObserved))
                .profileCount(profiles.size())
                .build();
    }
}
