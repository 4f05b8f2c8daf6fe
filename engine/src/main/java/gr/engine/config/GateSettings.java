package gr.engine.config;

import gr.engine.limiter.RateLimiterConfig;
import gr.engine.retry.RetryPolicy;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Already-parsed policy values for a {@link gr.engine.gate.CallGate}.
 *
 * <p>Property keys accepted by {@link #fromProperties(Properties)}:
 * <pre>
 * rateLimiting.enabled                (default true)
 * rateLimiting.maxRequestsPerMinute   (default 60)
 * rateLimiting.maxTokensPerMinute     (default 90000)
 * retry.maxAttempts                   (default 3)
 * retry.minWaitSeconds                (default 2)
 * retry.maxWaitSeconds                (default 10)
 * retry.multiplier                    (default 2)
 * </pre>
 */
public record GateSettings(
    boolean rateLimitingEnabled,
    long maxRequestsPerMinute,
    long maxTokensPerMinute,
    int maxAttempts,
    double minWaitSeconds,
    double maxWaitSeconds,
    double multiplier
) {
    public static final String RATE_LIMITING_ENABLED = "rateLimiting.enabled";
    public static final String MAX_REQUESTS_PER_MINUTE = "rateLimiting.maxRequestsPerMinute";
    public static final String MAX_TOKENS_PER_MINUTE = "rateLimiting.maxTokensPerMinute";
    public static final String RETRY_MAX_ATTEMPTS = "retry.maxAttempts";
    public static final String RETRY_MIN_WAIT_SECONDS = "retry.minWaitSeconds";
    public static final String RETRY_MAX_WAIT_SECONDS = "retry.maxWaitSeconds";
    public static final String RETRY_MULTIPLIER = "retry.multiplier";

    private static final GateSettings DEFAULTS = new GateSettings(true, 60, 90_000, 3, 2.0, 10.0, 2.0);

    public GateSettings {
        if (maxRequestsPerMinute <= 0) {
            throw new IllegalArgumentException("maxRequestsPerMinute must be > 0, got: " + maxRequestsPerMinute);
        }
        if (maxTokensPerMinute <= 0) {
            throw new IllegalArgumentException("maxTokensPerMinute must be > 0, got: " + maxTokensPerMinute);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (!(minWaitSeconds >= 0)) {
            throw new IllegalArgumentException("minWaitSeconds must be >= 0, got: " + minWaitSeconds);
        }
        if (!(maxWaitSeconds >= minWaitSeconds)) {
            throw new IllegalArgumentException("maxWaitSeconds must be >= minWaitSeconds, got: " + maxWaitSeconds);
        }
        if (!(multiplier > 1.0)) {
            throw new IllegalArgumentException("multiplier must be > 1, got: " + multiplier);
        }
    }

    public static GateSettings defaults() {
        return DEFAULTS;
    }

    /**
     * Reads the keys listed on this class; absent keys keep their default.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static GateSettings fromProperties(Properties properties) {
        if (properties == null) throw new IllegalArgumentException("properties cannot be null");

        return new GateSettings(
            readBoolean(properties, RATE_LIMITING_ENABLED, DEFAULTS.rateLimitingEnabled),
            readLong(properties, MAX_REQUESTS_PER_MINUTE, DEFAULTS.maxRequestsPerMinute),
            readLong(properties, MAX_TOKENS_PER_MINUTE, DEFAULTS.maxTokensPerMinute),
            readInt(properties, RETRY_MAX_ATTEMPTS, DEFAULTS.maxAttempts),
            readDouble(properties, RETRY_MIN_WAIT_SECONDS, DEFAULTS.minWaitSeconds),
            readDouble(properties, RETRY_MAX_WAIT_SECONDS, DEFAULTS.maxWaitSeconds),
            readDouble(properties, RETRY_MULTIPLIER, DEFAULTS.multiplier)
        );
    }

    /**
     * Loads a properties file from the classpath.
     *
     * @throws FileNotFoundException if the resource does not exist
     * @throws IOException if the resource cannot be read
     */
    public static GateSettings load(String resource) throws IOException {
        if (resource == null || resource.isEmpty()) {
            throw new IllegalArgumentException("resource must not be empty");
        }
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = GateSettings.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new FileNotFoundException("settings resource not found: " + resource);
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        }
    }

    public RateLimiterConfig toRateLimiterConfig() {
        return RateLimiterConfig.perMinute(maxRequestsPerMinute, maxTokensPerMinute);
    }

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.ofSeconds(maxAttempts, minWaitSeconds, maxWaitSeconds, multiplier);
    }

    private static boolean readBoolean(Properties properties, String key, boolean fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) return fallback;
        String value = raw.trim();
        if (value.equalsIgnoreCase("true")) return true;
        if (value.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + raw);
    }

    private static long readLong(Properties properties, String key, long fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static int readInt(Properties properties, String key, int fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
        }
    }

    private static double readDouble(Properties properties, String key, double fallback) {
        String raw = properties.getProperty(key);
        if (raw == null) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + raw, e);
        }
    }
}
