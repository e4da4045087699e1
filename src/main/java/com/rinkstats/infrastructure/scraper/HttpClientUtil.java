package com.rinkstats.infrastructure.scraper;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Map;

/**
 * Utility for making HTTP requests to the API and HTML report endpoints.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private HttpClientUtil() {
    }

    /**
     * Creates a pooled client with the given connect and read timeouts.
     */
    public static CloseableHttpClient createClient(Duration connectTimeout, Duration readTimeout, int maxConnections) {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
            .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
            .setSocketTimeout(Timeout.ofMilliseconds(readTimeout.toMillis()))
            .build();
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(connectionConfig)
            .setMaxConnTotal(maxConnections)
            .setMaxConnPerRoute(maxConnections)
            .build();
        return HttpClients.custom()
            .setConnectionManager(connectionManager)
            .build();
    }

    /**
     * Makes a GET request and returns status and body. Non-2xx responses are returned, not thrown,
     * so the caller can decide between absent, retry and failure.
     *
     * @param charset charset used to decode the body regardless of what the server declares
     */
    public static HttpResult get(CloseableHttpClient httpClient, String url, Map<String, String> headers,
                                 Charset charset) throws IOException {
        HttpGet request = new HttpGet(url);

        if (headers != null) {
            headers.forEach(request::addHeader);
        }

        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            String contentType = entity != null ? entity.getContentType() : null;
            String body = entity != null ? new String(EntityUtils.toByteArray(entity), charset) : "";

            if (statusCode >= 300 && statusCode != 404) {
                logger.warn("GET {} returned status {}", url, statusCode);
                logResponseBodyPreview(body);
            }
            return new HttpResult(statusCode, contentType, body);
        }
    }

    private static void logResponseBodyPreview(String responseBody) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.debug("Response body preview: {}", preview);
    }

    public record HttpResult(int statusCode, String contentType, String body) {

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
