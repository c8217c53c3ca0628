package com.fdsl.flow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fdsl.flow.io.ModelJson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Engine tuning, bound by Jackson from the classpath resource
 * {@value #RESOURCE}. Missing resource or missing fields keep the defaults.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {
    public static final String RESOURCE = "fdsl-engine.json";

    /** Memoize plans per (target, mode). */
    private boolean planCache = true;
    /** Message bus ring buffer capacity; must be a power of two. */
    private int busRingSize = 1024;
    /** Replay the latest message per source to new bus subscribers. */
    private boolean busKeepLast = true;
    /** Minimum interval between throttled error logs. */
    private long errorThrottleMillis = 1000;
    /** Attach a {@link com.fdsl.flow.util.LoggingExecutionListener} to the executor. */
    private boolean executionLogging = true;

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /** Loads {@value #RESOURCE} from the classpath, or the defaults when it is absent. */
    public static EngineConfig load() {
        return load(RESOURCE);
    }

    public static EngineConfig load(String resource) {
        InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            log.debug("No {} on the classpath, using defaults", resource);
            return defaults();
        }
        try (in) {
            EngineConfig config = ModelJson.mapper().readValue(in, EngineConfig.class);
            config.validate();
            log.info("Loaded engine config from {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed engine config " + resource, e);
        }
    }

    public void validate() {
        if (busRingSize < 1 || Integer.bitCount(busRingSize) != 1)
            throw new IllegalArgumentException("busRingSize must be a power of two: " + busRingSize);
        if (errorThrottleMillis < 0)
            throw new IllegalArgumentException("errorThrottleMillis must not be negative");
    }
}
