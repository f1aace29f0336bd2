package org.github.zzf.realtime.server;

import static org.assertj.core.api.BDDAssertions.then;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.util.concurrent.ImmediateEventExecutor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.server.Connection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HeartbeatMonitorTest {

    MutableClock clock;
    DefaultBroker broker;
    ScheduledExecutorService scheduler;
    HeartbeatMonitor monitor;

    @BeforeEach
    public void beforeEach() {
        clock = new MutableClock(0);
        broker = new DefaultBroker(new DefaultConnectionRegistry(new StubAuthenticator(), clock), ImmediateEventExecutor.INSTANCE);
        scheduler = mock(ScheduledExecutorService.class);
        monitor = new HeartbeatMonitor(broker.registry(), scheduler, clock, 25_000, 30_000);
    }

    private EmbeddedChannel connected() {
        EmbeddedChannel ch = new EmbeddedChannel();
        broker.accept(ch);
        // connection:established
        ch.readOutbound();
        return ch;
    }

    @Test
    void givenSilentConnection_whenTimeoutElapsed_thenEvicted() {
        EmbeddedChannel ch = connected();
        clock.advance(30_001);
        int evicted = monitor.tick();
        then(evicted).isEqualTo(1);
        then(broker.registry().size()).isZero();
        then(ch.isActive()).isFalse();
    }

    @Test
    void givenEvictedSubscriber_whenPublish_thenNotDelivered() {
        EmbeddedChannel ch = connected();
        Connection c = broker.registry().connections().iterator().next();
        broker.subscribe(c.id(), "order:1");
        // channel:subscribed
        ch.readOutbound();
        clock.advance(30_001);
        then(monitor.tick()).isEqualTo(1);
        then(broker.publish("order:1", Envelope.of("order:status", null))).isZero();
        then((Object) ch.readOutbound()).isNull();
    }

    @Test
    void givenConnectionAtTimeoutBoundary_whenTick_thenPingedNotEvicted() {
        EmbeddedChannel ch = connected();
        clock.advance(30_000);
        then(monitor.tick()).isZero();
        then(broker.registry().size()).isEqualTo(1);
        PingWebSocketFrame ping = ch.readOutbound();
        then(ping).isNotNull();
        ping.release();
    }

    @Test
    void givenActiveConnection_whenTouched_thenSurvivesAndSilentOneEvicted() {
        EmbeddedChannel alive = connected();
        EmbeddedChannel silent = connected();
        Connection aliveConnection = broker.registry().connections().stream()
                .filter(c -> c.channel() == alive).findFirst().orElseThrow();
        clock.advance(20_000);
        aliveConnection.touch();
        clock.advance(15_000);
        then(monitor.tick()).isEqualTo(1);
        then(alive.isActive()).isTrue();
        then(silent.isActive()).isFalse();
        then(broker.registry().connection(aliveConnection.id())).isNotNull();
    }

    @Test
    void givenMonitor_whenStart_thenScheduledAtInterval() {
        given(scheduler.scheduleAtFixedRate(any(Runnable.class), eq(25_000L), eq(25_000L), eq(TimeUnit.MILLISECONDS)))
                .willAnswer(inv -> mock(ScheduledFuture.class));
        monitor.start();
        then(monitor.isStarted()).isTrue();
        verify(scheduler).scheduleAtFixedRate(any(Runnable.class), eq(25_000L), eq(25_000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void givenStartedMonitor_whenClose_thenTaskCancelled() {
        ScheduledFuture<?> task = mock(ScheduledFuture.class);
        given(scheduler.scheduleAtFixedRate(any(Runnable.class), eq(25_000L), eq(25_000L), eq(TimeUnit.MILLISECONDS)))
                .willAnswer(inv -> task);
        monitor.start();
        monitor.close();
        verify(task).cancel(false);
        then(monitor.isStarted()).isFalse();
    }

}
