package com.rinkstats.infrastructure.scraper;

import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceFetchResult;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.SourceFetcher;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Fetches the structured API documents and the legacy HTML reports of a game.
 */
public class NhlSourceFetcher implements SourceFetcher {

    private static final Logger logger = LoggerFactory.getLogger(NhlSourceFetcher.class);

    private static final Map<String, String> JSON_HEADERS = Map.of(
        "accept", "application/json",
        "user-agent", "Mozilla/5.0 (X11; Linux x86_64) rinkstats-pbp-scrapers"
    );

    private static final Map<String, String> HTML_HEADERS = Map.of(
        "accept", "text/html",
        "user-agent", "Mozilla/5.0 (X11; Linux x86_64) rinkstats-pbp-scrapers"
    );

    private final CloseableHttpClient httpClient;
    private final String apiBaseUrl;
    private final String htmlBaseUrl;
    private final RetryBackoff backoff;
    private final RequestThrottle throttle;

    public NhlSourceFetcher(CloseableHttpClient httpClient, String apiBaseUrl, String htmlBaseUrl,
                            RetryBackoff backoff, RequestThrottle throttle) {
        this.httpClient = httpClient;
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.htmlBaseUrl = stripTrailingSlash(htmlBaseUrl);
        this.backoff = backoff;
        this.throttle = throttle;
    }

    /**
     * URL of a source for a game. Both API event and roster data come from the play-by-play document.
     */
    public String urlFor(GameId gameId, SourceKind kind) {
        return switch (kind) {
            case API_EVENTS, API_ROSTERS -> apiBaseUrl + "/gamecenter/" + gameId + "/play-by-play";
            case API_GAME_INFO -> apiBaseUrl + "/gamecenter/" + gameId + "/landing";
            case HTML_EVENTS -> htmlReportUrl(gameId, "PL");
            case HTML_ROSTERS -> htmlReportUrl(gameId, "RO");
            case HTML_HOME_SHIFTS -> htmlReportUrl(gameId, "TH");
            case HTML_AWAY_SHIFTS -> htmlReportUrl(gameId, "TV");
        };
    }

    private String htmlReportUrl(GameId gameId, String prefix) {
        return htmlBaseUrl + "/" + gameId.season() + "/" + prefix + gameId.htmlId() + ".HTM";
    }

    @Override
    public SourceFetchResult fetch(GameId gameId, SourceKind kind) {
        String url = urlFor(gameId, kind);
        Map<String, String> headers = kind.isHtml() ? HTML_HEADERS : JSON_HEADERS;
        Charset charset = kind.isHtml() ? StandardCharsets.ISO_8859_1 : StandardCharsets.UTF_8;
        String lastError = null;

        for (int attempt = 1; attempt <= backoff.getMaxAttempts(); attempt++) {
            try {
                if (attempt > 1) {
                    long delay = backoff.delayMs(attempt - 1);
                    logger.warn("Retrying {} {} (attempt {}/{}) in {} ms: {}",
                        gameId, kind, attempt, backoff.getMaxAttempts(), delay, lastError);
                    Thread.sleep(delay);
                }
                throttle.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SourceFetchResult.failed(kind, "Interrupted while fetching " + url);
            }

            HttpClientUtil.HttpResult result;
            try {
                result = HttpClientUtil.get(httpClient, url, headers, charset);
            } catch (IOException e) {
                lastError = e.getClass().getSimpleName() + ": " + e.getMessage();
                continue;
            }

            if (result.statusCode() == 404) {
                logger.info("{} {} not published ({})", gameId, kind, url);
                return SourceFetchResult.absent(kind, "Not found: " + url);
            }
            if (result.isSuccess()) {
                if (result.body() == null || result.body().isBlank()) {
                    logger.info("{} {} returned an empty document", gameId, kind);
                    return SourceFetchResult.absent(kind, "Empty document: " + url);
                }
                logger.debug("Fetched {} {} ({} chars)", gameId, kind, result.body().length());
                return SourceFetchResult.present(new RawSource(gameId, kind, url, result.body()));
            }
            if (!backoff.isRetryableStatus(result.statusCode())) {
                logger.error("{} {} failed with status {}", gameId, kind, result.statusCode());
                return SourceFetchResult.failed(kind, "HTTP " + result.statusCode() + " from " + url);
            }
            lastError = "HTTP " + result.statusCode();
        }

        logger.error("{} {} failed after {} attempts: {}", gameId, kind, backoff.getMaxAttempts(), lastError);
        return SourceFetchResult.failed(kind, "Gave up on " + url + " after " + backoff.getMaxAttempts()
            + " attempts: " + lastError);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
