package com.rinkstats.application.usecase;

import com.rinkstats.domain.model.ApiRosterPlayer;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.HtmlRosterPlayer;
import com.rinkstats.domain.model.PlayerShift;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.ports.SourceNormalizer;

/**
 * The normalizer for each source kind the pipeline reads.
 */
public record SourceNormalizers(
    SourceNormalizer<GameInfo> gameInfo,
    SourceNormalizer<ApiRosterPlayer> apiRosters,
    SourceNormalizer<HtmlRosterPlayer> htmlRosters,
    SourceNormalizer<PlayerShift> shifts,
    SourceNormalizer<SourceEvent> apiEvents,
    SourceNormalizer<SourceEvent> htmlEvents
) {
}
