package com.acme.kvstore.idalloc.counter.http;

import com.acme.kvstore.idalloc.counter.CounterKey;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Route constants and path helpers for the counter HTTP API.
 */
public final class CounterEndpoints {
    public static final String COUNTERS_PREFIX = "/v1/counters/";
    public static final String INCREMENT_SUFFIX = "/increment";

    public static final String FIELD_KEY = "key";
    public static final String FIELD_DELTA = "delta";
    public static final String FIELD_VALUE = "value";

    public static final String CONTENT_TYPE_JSON = "application/json";

    private CounterEndpoints() {
    }

    public static String incrementPath(CounterKey key) {
        return COUNTERS_PREFIX + URLEncoder.encode(key.name(), StandardCharsets.UTF_8).replace("+", "%20")
            + INCREMENT_SUFFIX;
    }

    /**
     * Extracts the counter key from an increment request URI.
     *
     * @return the key, {@link CounterKey#INVALID} for an empty key segment, or
     *         {@code null} if the path is not an increment route
     */
    public static CounterKey keyFromIncrementPath(String uri) {
        String path = new QueryStringDecoder(uri).rawPath();
        if (!path.startsWith(COUNTERS_PREFIX) || !path.endsWith(INCREMENT_SUFFIX)) {
            return null;
        }
        int start = COUNTERS_PREFIX.length();
        int end = path.length() - INCREMENT_SUFFIX.length();
        if (end < start) {
            return null;
        }
        String rawKey = path.substring(start, end);
        if (rawKey.indexOf('/') >= 0) {
            return null;
        }
        return new CounterKey(QueryStringDecoder.decodeComponent(rawKey, StandardCharsets.UTF_8));
    }
}
