package com.s1export.collector.client;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * SentinelOne management API transport over OkHttp. Adds the API token and JSON
 * content type to every request and returns the raw status and body.
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} is thread-safe, and this class
 * holds no mutable per-request state.</p>
 */
public class OkHttpTransportClient implements TransportClient {

    private static final Logger logger = LoggerFactory.getLogger(OkHttpTransportClient.class);

    static final String AUTH_SCHEME = "ApiToken";
    private static final int TIMEOUT_SECONDS = 30;

    private final OkHttpClient httpClient;
    private final String token;

    public OkHttpTransportClient(String token) {
        this(token, defaultHttpClient());
    }

    public OkHttpTransportClient(String token, OkHttpClient httpClient) {
        this.token = token;
        this.httpClient = httpClient;
    }

    private static OkHttpClient defaultHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .readTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .writeTimeout(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public TransportResponse get(String url, Map<String, ?> params) throws IOException {
        Request request = buildRequest(url, params);

        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            logger.info("S1 API {} {}", statusCode, request.url());

            ResponseBody body = response.body();
            String bodyString = body != null ? body.string() : null;
            return new TransportResponse(statusCode, bodyString, parseRetryAfter(response.header("Retry-After")));
        }
    }

    /**
     * Builds a GET request with token authentication and the given query parameters.
     */
    Request buildRequest(String url, Map<String, ?> params) {
        HttpUrl parsed = HttpUrl.parse(url);
        if (parsed == null) {
            throw new IllegalArgumentException("Not an http(s) URL: " + url);
        }
        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        if (params != null) {
            params.forEach((key, value) -> urlBuilder.addQueryParameter(key, String.valueOf(value)));
        }

        return new Request.Builder()
                .url(urlBuilder.build())
                .header("Authorization", AUTH_SCHEME + " " + token)
                .header("Content-Type", "application/json")
                .get()
                .build();
    }

    /**
     * Reads a delay-seconds {@code Retry-After} value. HTTP-date values are ignored.
     */
    static Optional<Duration> parseRetryAfter(String retryAfter) {
        if (retryAfter == null || retryAfter.isBlank()) {
            return Optional.empty();
        }
        try {
            long seconds = Long.parseLong(retryAfter.trim());
            return seconds >= 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
        } catch (NumberFormatException ignored) {
            return Optional.empty();
        }
    }
}
