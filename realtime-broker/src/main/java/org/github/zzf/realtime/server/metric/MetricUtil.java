package org.github.zzf.realtime.server.metric;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

public class MetricUtil {

    public static volatile boolean metricOn = true;

    private MetricUtil() {
    }

    private static final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

    /**
     * Timer
     *
     * @param metricName metric name
     * @param nanos elapsed time in nanoseconds
     * @param tags key/value pairs, may be empty
     */
    public static void nanoTime(String metricName, long nanos, String... tags) {
        if (!metricOn) {
            return;
        }
        timers.computeIfAbsent(id(metricName, tags), id -> Timer.builder(metricName)
                        .tags(tags)
                        .publishPercentileHistogram()
                        .minimumExpectedValue(Duration.ofMillis(1))
                        .maximumExpectedValue(Duration.ofSeconds(10))
                        .register(Metrics.globalRegistry))
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    private static String id(String metricName, String[] tags) {
        StringBuilder buf = new StringBuilder(metricName);
        for (String tag : tags) {
            buf.append(tag);
        }
        return buf.toString();
    }

    /**
     * Counter, +1
     *
     * @param metricName metric name
     * @param tags key/value pairs, may be empty
     */
    public static void count(String metricName, String... tags) {
        count(metricName, 1, tags);
    }

    public static void count(String metricName, int value, String... tags) {
        if (!metricOn || value == 0) {
            return;
        }
        Metrics.counter(metricName, tags).increment(value);
    }

    /**
     * Gauge on the size of the map. The registry holds a weak reference to the map.
     */
    public static void gauge(String metricName, Map<?, ?> map) {
        if (!metricOn) {
            return;
        }
        Metrics.gauge(metricName, map, Map::size);
    }

}
