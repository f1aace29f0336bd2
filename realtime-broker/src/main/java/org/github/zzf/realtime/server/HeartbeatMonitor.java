package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.ConnectionRegistry;
import org.github.zzf.realtime.server.metric.MetricUtil;

/**
 * Sends a ping frame to every connection and evicts the ones that have been silent for longer than
 * the connection timeout. The only component that removes connections on time alone.
 */
@Slf4j
public class HeartbeatMonitor implements AutoCloseable {

    private final ConnectionRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long intervalMillis;
    private final long timeoutMillis;

    private volatile ScheduledFuture<?> task;

    public HeartbeatMonitor(ConnectionRegistry registry,
            ScheduledExecutorService scheduler,
            Clock clock,
            long intervalMillis,
            long timeoutMillis) {
        checkNotNull(registry);
        checkNotNull(scheduler);
        checkNotNull(clock);
        checkArgument(intervalMillis > 0, "intervalMillis must be positive");
        checkArgument(timeoutMillis > 0, "timeoutMillis must be positive");
        this.registry = registry;
        this.scheduler = scheduler;
        this.clock = clock;
        this.intervalMillis = intervalMillis;
        this.timeoutMillis = timeoutMillis;
    }

    public synchronized HeartbeatMonitor start() {
        if (task != null) {
            return this;
        }
        task = scheduler.scheduleAtFixedRate(this::safeTick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("HeartbeatMonitor started, interval: {}ms, timeout: {}ms", intervalMillis, timeoutMillis);
        return this;
    }

    private void safeTick() {
        // an exception would cancel the periodic task
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("HeartbeatMonitor tick failed", e);
        }
    }

    /**
     * one ping round
     *
     * @return number of evicted connections
     */
    public int tick() {
        long now = clock.millis();
        int evicted = 0;
        int pinged = 0;
        for (Connection c : registry.connections()) {
            long silence = now - c.lastActivityAt();
            if (silence > timeoutMillis) {
                log.warn("Connection({}) silent for {}ms, now evict it", c.id(), silence);
                if (registry.remove(c.id())) {
                    evicted += 1;
                }
            }
            else {
                c.ping();
                pinged += 1;
            }
        }
        log.debug("HeartbeatMonitor tick, pinged: {}, evicted: {}", pinged, evicted);
        MetricUtil.count("realtime.server.heartbeat.evicted", evicted);
        return evicted;
    }

    public boolean isStarted() {
        return task != null;
    }

    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
            log.info("HeartbeatMonitor closed");
        }
    }

}
