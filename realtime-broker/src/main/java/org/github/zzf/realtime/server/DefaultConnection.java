package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import java.net.SocketAddress;
import java.time.Clock;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.server.Connection;

@Slf4j
public class DefaultConnection implements Connection {

    public static final ChannelFutureListener LOG_ON_FAILURE = future -> {
        if (!future.isSuccess()) {
            log.debug("Channel({}) writeAndFlush failed: {}", future.channel(), future.cause().toString());
        }
    };

    enum State {
        UNAUTHENTICATED,
        AUTHENTICATED,
        CLOSED,
    }

    private final String id;
    private final Channel channel;
    private final Clock clock;
    private final long connectedAt;
    private final Set<String> channels = ConcurrentHashMap.newKeySet();

    private volatile State state = State.UNAUTHENTICATED;
    private volatile Identity identity;
    private volatile long lastActivityAt;
    private volatile Future<?> handshakeTimeout;

    public DefaultConnection(String id, Channel channel, Clock clock) {
        checkNotNull(id);
        checkNotNull(channel);
        checkNotNull(clock);
        this.id = id;
        this.channel = channel;
        this.clock = clock;
        this.connectedAt = clock.millis();
        this.lastActivityAt = this.connectedAt;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Nullable
    @Override
    public SocketAddress remoteAddress() {
        return channel.remoteAddress();
    }

    @Nullable
    @Override
    public Identity identity() {
        return identity;
    }

    @Override
    public Set<String> channels() {
        return Collections.unmodifiableSet(channels);
    }

    @Override
    public boolean subscribed(String channel) {
        return channels.contains(channel);
    }

    @Override
    public long connectedAt() {
        return connectedAt;
    }

    @Override
    public long lastActivityAt() {
        return lastActivityAt;
    }

    @Override
    public void touch() {
        lastActivityAt = clock.millis();
    }

    @Override
    public ChannelFuture send(Envelope envelope) {
        if (!channel.isActive()) {
            return channel.newFailedFuture(new IllegalStateException("Connection(" + id + ") is not active"));
        }
        return channel.writeAndFlush(envelope).addListener(LOG_ON_FAILURE);
    }

    @Override
    public ChannelFuture ping() {
        return channel.writeAndFlush(new PingWebSocketFrame()).addListener(LOG_ON_FAILURE);
    }

    @Override
    public boolean isActive() {
        return state != State.CLOSED && channel.isActive();
    }

    State state() {
        return state;
    }

    boolean subscribe(String channel) {
        return channels.add(channel);
    }

    boolean unsubscribe(String channel) {
        return channels.remove(channel);
    }

    /**
     * attach (or replace, on a re-handshake) the verified identity. channel subscriptions are left to the broker.
     */
    boolean authenticated(Identity identity) {
        if (state == State.CLOSED) {
            return false;
        }
        this.identity = identity;
        this.state = State.AUTHENTICATED;
        cancelHandshakeTimeout();
        return true;
    }

    void handshakeTimeout(Future<?> timeout) {
        this.handshakeTimeout = timeout;
    }

    @Nullable
    Future<?> handshakeTimeout() {
        return handshakeTimeout;
    }

    /**
     * @return false if the connection was already closed
     */
    boolean closed() {
        if (state == State.CLOSED) {
            return false;
        }
        state = State.CLOSED;
        cancelHandshakeTimeout();
        if (channel.isOpen()) {
            channel.close();
        }
        return true;
    }

    private void cancelHandshakeTimeout() {
        Future<?> f = handshakeTimeout;
        if (f != null) {
            f.cancel(false);
            handshakeTimeout = null;
        }
    }

    @Override
    public String toString() {
        return "{\"id\":\"" + id + "\",\"state\":\"" + state + "\",\"identity\":" + identity
                + ",\"channels\":" + channels + ",\"remoteAddress\":\"" + remoteAddress() + "\"}";
    }

}
