package com.rinkstats.support;

import com.rinkstats.application.cache.GameCache;
import com.rinkstats.application.enrich.PlayByPlayAssembler;
import com.rinkstats.application.reconcile.ChangeReconciler;
import com.rinkstats.application.reconcile.CorrectionTable;
import com.rinkstats.application.reconcile.EventReconciler;
import com.rinkstats.application.reconcile.PlayerNameMatcher;
import com.rinkstats.application.reconcile.RosterReconciler;
import com.rinkstats.application.scoring.ScoringAdapter;
import com.rinkstats.application.usecase.GamePipeline;
import com.rinkstats.application.usecase.SourceNormalizers;
import com.rinkstats.domain.ports.PlayByPlayRepository;
import com.rinkstats.domain.ports.SourceFetcher;
import com.rinkstats.infrastructure.scoring.LogisticShotModel;
import com.rinkstats.infrastructure.scraper.api.ApiEventReparser;
import com.rinkstats.infrastructure.scraper.api.ApiEventsNormalizer;
import com.rinkstats.infrastructure.scraper.api.ApiGameInfoNormalizer;
import com.rinkstats.infrastructure.scraper.api.ApiRostersNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlEventReparser;
import com.rinkstats.infrastructure.scraper.html.HtmlEventsNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlRostersNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlShiftsNormalizer;

import java.util.List;

/**
 * Wires a game pipeline the way the application context does, around a test fetcher.
 */
public final class TestPipelines {

    private TestPipelines() {
    }

    public static GamePipeline create(SourceFetcher fetcher, GameCache cache, PlayByPlayRepository repository) {
        return create(fetcher, cache, repository, CorrectionTable.empty());
    }

    public static GamePipeline create(SourceFetcher fetcher, GameCache cache, PlayByPlayRepository repository,
                                      CorrectionTable corrections) {
        SourceNormalizers normalizers = new SourceNormalizers(new ApiGameInfoNormalizer(), new ApiRostersNormalizer(),
            new HtmlRostersNormalizer(), new HtmlShiftsNormalizer(), new ApiEventsNormalizer(),
            new HtmlEventsNormalizer());
        EventReconciler eventReconciler = new EventReconciler(corrections,
            List.of(new ApiEventReparser(), new HtmlEventReparser()));
        return new GamePipeline(fetcher, normalizers, new RosterReconciler(), new ChangeReconciler(),
            eventReconciler, new PlayByPlayAssembler(), new ScoringAdapter(new LogisticShotModel()), cache,
            new PlayerNameMatcher(), repository, 4);
    }

    public static GamePipeline create(SourceFetcher fetcher) {
        return create(fetcher, new GameCache(), null);
    }
}
