package com.telereplay.archive;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP clients and JSON mapper for archive access.
 *
 * Archive selects over several minutes of high-rate telemetry can take long
 * to answer, so the query timeout is far above the connect timeout. Each
 * client keeps one idle connection per concurrent fetch.
 */
public final class HttpClientFactory {

    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMinutes(5);
    public static final int DEFAULT_CONNECTIONS = 10;

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration IDLE_CONNECTION_TIMEOUT = Duration.ofMinutes(5);

    private static final OkHttpClient DEFAULT_CLIENT = newClient(DEFAULT_QUERY_TIMEOUT, DEFAULT_CONNECTIONS);
    private static final ObjectMapper ARCHIVE_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private HttpClientFactory() {
    }

    /**
     * Client with the default query timeout, shared by all archive clients built without one.
     */
    public static OkHttpClient getClient() {
        return DEFAULT_CLIENT;
    }

    /**
     * Build a client for an archive session.
     *
     * @param queryTimeout   Longest wait for a query response
     * @param maxConnections Idle connections kept, usually the number of concurrent fetches
     */
    public static OkHttpClient newClient(Duration queryTimeout, int maxConnections) {
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("queryTimeout must be positive: " + queryTimeout);
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1: " + maxConnections);
        }
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(maxConnections,
                IDLE_CONNECTION_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS))
            .connectTimeout(CONNECT_TIMEOUT)
            .readTimeout(queryTimeout)
            .writeTimeout(CONNECT_TIMEOUT)
            .retryOnConnectionFailure(true)
            .build();
    }

    /**
     * Mapper for archive responses; ignores response properties it does not know.
     */
    public static ObjectMapper getMapper() {
        return ARCHIVE_MAPPER;
    }
}
