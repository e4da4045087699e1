package com.rinkstats.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rinkstats.application.cache.GameCache;
import com.rinkstats.application.enrich.PlayByPlayAssembler;
import com.rinkstats.application.reconcile.ChangeReconciler;
import com.rinkstats.application.reconcile.CorrectionTable;
import com.rinkstats.application.reconcile.EventReconciler;
import com.rinkstats.application.reconcile.PlayerNameMatcher;
import com.rinkstats.application.reconcile.RosterReconciler;
import com.rinkstats.application.scoring.ScoringAdapter;
import com.rinkstats.application.stats.StatsAggregator;
import com.rinkstats.application.usecase.CollectionScraper;
import com.rinkstats.application.usecase.GamePipeline;
import com.rinkstats.application.usecase.SourceNormalizers;
import com.rinkstats.domain.ports.PlayByPlayRepository;
import com.rinkstats.domain.ports.ScoringFunction;
import com.rinkstats.domain.ports.SourceFetcher;
import com.rinkstats.infrastructure.corrections.CorrectionRuleLoader;
import com.rinkstats.infrastructure.scoring.LogisticShotModel;
import com.rinkstats.infrastructure.scraper.HttpClientUtil;
import com.rinkstats.infrastructure.scraper.NhlSourceFetcher;
import com.rinkstats.infrastructure.scraper.RequestThrottle;
import com.rinkstats.infrastructure.scraper.RetryBackoff;
import com.rinkstats.infrastructure.scraper.api.ApiEventReparser;
import com.rinkstats.infrastructure.scraper.api.ApiEventsNormalizer;
import com.rinkstats.infrastructure.scraper.api.ApiGameInfoNormalizer;
import com.rinkstats.infrastructure.scraper.api.ApiRostersNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlEventReparser;
import com.rinkstats.infrastructure.scraper.html.HtmlEventsNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlRostersNormalizer;
import com.rinkstats.infrastructure.scraper.html.HtmlShiftsNormalizer;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Wires the pipeline stages. Every stage is a plain class; this is the only place that knows about
 * Spring.
 */
@Configuration
public class ScraperConfig {

    @Bean(destroyMethod = "close")
    public CloseableHttpClient scraperHttpClient(
            @Value("${rinkstats.http.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${rinkstats.http.read-timeout-ms:20000}") long readTimeoutMs,
            @Value("${rinkstats.http.max-connections:16}") int maxConnections) {
        return HttpClientUtil.createClient(Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(readTimeoutMs),
            maxConnections);
    }

    @Bean
    public SourceFetcher sourceFetcher(
            CloseableHttpClient scraperHttpClient,
            @Value("${rinkstats.api.base-url:https://api-web.nhle.com/v1}") String apiBaseUrl,
            @Value("${rinkstats.html.base-url:https://www.nhl.com/scores/htmlreports}") String htmlBaseUrl,
            @Value("${rinkstats.retry.max-attempts:4}") int maxAttempts,
            @Value("${rinkstats.retry.min-delay-ms:500}") long minDelayMs,
            @Value("${rinkstats.retry.max-delay-ms:8000}") long maxDelayMs,
            @Value("${rinkstats.http.min-request-interval-ms:250}") long minRequestIntervalMs) {
        return new NhlSourceFetcher(scraperHttpClient, apiBaseUrl, htmlBaseUrl,
            new RetryBackoff(maxAttempts, minDelayMs, maxDelayMs), new RequestThrottle(minRequestIntervalMs));
    }

    @Bean
    public SourceNormalizers sourceNormalizers() {
        return new SourceNormalizers(
            new ApiGameInfoNormalizer(),
            new ApiRostersNormalizer(),
            new HtmlRostersNormalizer(),
            new HtmlShiftsNormalizer(),
            new ApiEventsNormalizer(),
            new HtmlEventsNormalizer());
    }

    @Bean
    public CorrectionTable correctionTable(ObjectMapper objectMapper,
            @Value("${rinkstats.corrections.resource:" + CorrectionRuleLoader.DEFAULT_RESOURCE + "}") String resource) {
        return new CorrectionRuleLoader(objectMapper).load(resource);
    }

    @Bean
    public PlayerNameMatcher playerNameMatcher(
            @Value("${rinkstats.reconcile.name-threshold:" + PlayerNameMatcher.DEFAULT_THRESHOLD + "}") double threshold) {
        return new PlayerNameMatcher(threshold);
    }

    @Bean
    public EventReconciler eventReconciler(CorrectionTable correctionTable,
            @Value("${rinkstats.reconcile.match-window-seconds:" + EventReconciler.DEFAULT_MATCH_WINDOW_SECONDS + "}")
            int matchWindowSeconds,
            @Value("${rinkstats.reconcile.min-player-overlap:" + EventReconciler.DEFAULT_MIN_PLAYER_OVERLAP + "}")
            int minPlayerOverlap) {
        return new EventReconciler(correctionTable, List.of(new ApiEventReparser(), new HtmlEventReparser()),
            matchWindowSeconds, minPlayerOverlap);
    }

    @Bean
    public ScoringFunction scoringFunction(
            @Value("${rinkstats.scoring.intercept:-1.2}") double intercept,
            @Value("${rinkstats.scoring.distance-weight:-0.045}") double distanceWeight,
            @Value("${rinkstats.scoring.angle-weight:-0.012}") double angleWeight,
            @Value("${rinkstats.scoring.rebound-weight:0.9}") double reboundWeight,
            @Value("${rinkstats.scoring.rush-weight:0.35}") double rushWeight,
            @Value("${rinkstats.scoring.empty-net-weight:3.0}") double emptyNetWeight,
            @Value("${rinkstats.scoring.high-danger-weight:0.4}") double highDangerWeight,
            @Value("${rinkstats.scoring.power-play-weight:0.3}") double powerPlayWeight) {
        return new LogisticShotModel(intercept, distanceWeight, angleWeight, reboundWeight, rushWeight,
            emptyNetWeight, highDangerWeight, powerPlayWeight);
    }

    @Bean
    public GameCache gameCache() {
        return new GameCache();
    }

    @Bean(destroyMethod = "close")
    public GamePipeline gamePipeline(SourceFetcher sourceFetcher, SourceNormalizers sourceNormalizers,
                                     EventReconciler eventReconciler, ScoringFunction scoringFunction,
                                     GameCache gameCache, PlayerNameMatcher playerNameMatcher,
                                     ObjectProvider<PlayByPlayRepository> repository,
                                     @Value("${rinkstats.pipeline.fetch-pool-size:7}") int fetchPoolSize) {
        return new GamePipeline(sourceFetcher, sourceNormalizers, new RosterReconciler(), new ChangeReconciler(),
            eventReconciler, new PlayByPlayAssembler(), new ScoringAdapter(scoringFunction), gameCache,
            playerNameMatcher, repository.getIfAvailable(), fetchPoolSize);
    }

    @Bean(destroyMethod = "close")
    public CollectionScraper collectionScraper(GamePipeline gamePipeline,
            @Value("${rinkstats.collection.game-pool-size:4}") int gamePoolSize) {
        return new CollectionScraper(gamePipeline, new StatsAggregator(), gamePoolSize);
    }
}
