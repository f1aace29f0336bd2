package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSONObject;
import io.netty.channel.Channel;
import io.netty.util.concurrent.EventExecutorGroup;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.ErrorCode;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.model.MessageType;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.EventHandler;
import org.github.zzf.realtime.protocol.server.SubscriptionListener;
import org.github.zzf.realtime.server.metric.MetricUtil;

@Slf4j
public class DefaultBroker implements Broker {

    private final DefaultConnectionRegistry registry;
    private final EventDispatcher dispatcher;
    private final long handshakeTimeoutMillis;
    private final List<SubscriptionListener> subscriptionListeners = new CopyOnWriteArrayList<>();

    public DefaultBroker(DefaultConnectionRegistry registry, EventExecutorGroup handlerExecutor) {
        this(registry, handlerExecutor, 0);
    }

    public DefaultBroker(DefaultConnectionRegistry registry,
            EventExecutorGroup handlerExecutor,
            long handshakeTimeoutMillis) {
        checkNotNull(registry);
        this.registry = registry;
        this.handshakeTimeoutMillis = handshakeTimeoutMillis;
        this.dispatcher = new EventDispatcher(controlHandlers(), handlerExecutor);
    }

    private Map<MessageType, EventHandler> controlHandlers() {
        Map<MessageType, EventHandler> map = new EnumMap<>(MessageType.class);
        for (MessageType t : MessageType.values()) {
            if (!t.inbound()) {
                continue;
            }
            EventHandler handler = switch (t) {
                case AUTHENTICATE -> EventHandler.of((c, e) -> authenticate(c.id(), e.dataString("token")));
                case SUBSCRIBE -> EventHandler.of(this::onSubscribe);
                case UNSUBSCRIBE -> EventHandler.of(this::onUnsubscribe);
                case PING -> EventHandler.of((c, e) -> c.send(Envelope.of(MessageType.PONG, new JSONObject(), e.requestId())));
                default -> throw new IllegalStateException("no handler for inbound type: " + t);
            };
            map.put(t, handler);
        }
        return map;
    }

    @Override
    public Connection accept(Channel channel) {
        DefaultConnection c = registry.accept(channel);
        JSONObject data = new JSONObject(true);
        data.put("clientId", c.id());
        c.send(Envelope.of(MessageType.CONNECTION_ESTABLISHED, data));
        if (handshakeTimeoutMillis > 0) {
            c.handshakeTimeout(channel.eventLoop().schedule(() -> handshakeTimeout(c),
                    handshakeTimeoutMillis, TimeUnit.MILLISECONDS));
        }
        return c;
    }

    private void handshakeTimeout(DefaultConnection c) {
        if (c.authenticated()) {
            return;
        }
        log.warn("Connection({}) did not authenticate in {}ms, now close it", c.id(), handshakeTimeoutMillis);
        MetricUtil.count("realtime.server.handshake.timeout");
        c.send(Envelope.error(ErrorCode.AUTHENTICATION_REQUIRED, "Authentication timeout", null))
                .addListener(f -> registry.remove(c.id()));
    }

    @Override
    public boolean authenticate(String connectionId, String credential) {
        DefaultConnection c = registry.connection(connectionId);
        if (c == null) {
            log.debug("Connection({}) is gone, ignore the handshake", connectionId);
            return false;
        }
        Identity previous = c.identity();
        Identity identity;
        try {
            identity = registry.authenticate(connectionId, credential);
        } catch (AuthenticationException e) {
            log.info("Connection({}) authentication failed, now send error and close it -> {}", connectionId, e.getMessage());
            MetricUtil.count("realtime.server.authentication", "result", "failed");
            String message = e.getMessage() != null ? e.getMessage() : "Authentication failed";
            c.send(Envelope.error(ErrorCode.AUTHENTICATION_FAILED, message, null))
                    .addListener(f -> registry.remove(connectionId));
            return false;
        }
        MetricUtil.count("realtime.server.authentication", "result", "success");
        if (previous != null && !previous.userId().equals(identity.userId())) {
            // the channel of the former user must not outlive its identity
            log.info("Connection({}) re-authenticated as another user: {} -> {}",
                    connectionId, previous.userId(), identity.userId());
            unsubscribe(connectionId, previous.userChannel(), null);
        }
        subscribe(connectionId, identity.userChannel(), null);
        JSONObject data = new JSONObject(true);
        data.put("userId", identity.userId());
        data.put("roles", identity.roles());
        c.send(Envelope.of(MessageType.AUTHENTICATED, data));
        return true;
    }

    @Override
    public void onEnvelope(Connection connection, Envelope envelope) {
        dispatcher.dispatch(connection, envelope);
    }

    @Override
    public void disconnect(String connectionId) {
        registry.remove(connectionId);
    }

    private void onSubscribe(Connection c, Envelope e) {
        String channel = e.dataString("channel");
        if (channel == null || channel.isEmpty()) {
            c.send(Envelope.error(ErrorCode.INVALID_REQUEST, "channel is required", e.requestId()));
            return;
        }
        if (foreignUserChannel(c, channel)) {
            log.warn("Connection({}) tried to subscribe to {}", c.id(), channel);
            c.send(Envelope.error(ErrorCode.FORBIDDEN, "Cannot subscribe to " + channel, e.requestId()));
            return;
        }
        subscribe(c.id(), channel, e.requestId());
    }

    private void onUnsubscribe(Connection c, Envelope e) {
        String channel = e.dataString("channel");
        if (channel == null || channel.isEmpty()) {
            c.send(Envelope.error(ErrorCode.INVALID_REQUEST, "channel is required", e.requestId()));
            return;
        }
        unsubscribe(c.id(), channel, e.requestId());
    }

    private static boolean foreignUserChannel(Connection c, String channel) {
        if (!channel.startsWith(Identity.USER_CHANNEL_PREFIX)) {
            return false;
        }
        Identity identity = c.identity();
        return identity == null || !identity.userChannel().equals(channel);
    }

    @Override
    public boolean subscribe(String connectionId, String channel) {
        return subscribe(connectionId, channel, null);
    }

    private boolean subscribe(String connectionId, String channel, @Nullable String requestId) {
        DefaultConnection c = registry.connection(connectionId);
        if (c == null) {
            return false;
        }
        boolean added = c.subscribe(channel);
        log.debug("Connection({}) subscribe {}, new: {}", connectionId, channel, added);
        c.send(Envelope.of(MessageType.SUBSCRIBED, channelData(channel), requestId));
        for (SubscriptionListener l : subscriptionListeners) {
            try {
                l.subscribed(c, channel);
            } catch (RuntimeException ex) {
                log.error("Connection({}) SubscriptionListener failed on {}", connectionId, channel, ex);
            }
        }
        return added;
    }

    @Override
    public boolean unsubscribe(String connectionId, String channel) {
        return unsubscribe(connectionId, channel, null);
    }

    private boolean unsubscribe(String connectionId, String channel, @Nullable String requestId) {
        DefaultConnection c = registry.connection(connectionId);
        if (c == null) {
            return false;
        }
        boolean removed = c.unsubscribe(channel);
        log.debug("Connection({}) unsubscribe {}, removed: {}", connectionId, channel, removed);
        c.send(Envelope.of(MessageType.UNSUBSCRIBED, channelData(channel), requestId));
        return removed;
    }

    private static JSONObject channelData(String channel) {
        JSONObject data = new JSONObject(true);
        data.put("channel", channel);
        return data;
    }

    @Override
    public int publish(String channel, Envelope envelope) {
        Envelope out = envelope.withChannel(channel);
        int delivered = 0;
        for (DefaultConnection c : registry.connections()) {
            if (c.subscribed(channel)) {
                deliver(c, out);
                delivered += 1;
            }
        }
        log.debug("publish {} to {} -> {} connections", envelope.type(), channel, delivered);
        MetricUtil.count("realtime.broker.publish.delivered", delivered);
        return delivered;
    }

    @Override
    public int broadcast(Envelope envelope, Predicate<Connection> filter) {
        int delivered = 0;
        for (DefaultConnection c : registry.connections()) {
            if (filter.test(c)) {
                deliver(c, envelope);
                delivered += 1;
            }
        }
        log.debug("broadcast {} -> {} connections", envelope.type(), delivered);
        MetricUtil.count("realtime.broker.broadcast.delivered", delivered);
        return delivered;
    }

    private void deliver(DefaultConnection c, Envelope envelope) {
        // a dead connection is left to the HeartbeatMonitor
        c.send(envelope);
    }

    @Override
    public CompletableFuture<Void> send(String connectionId, Envelope envelope) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        DefaultConnection c = registry.connection(connectionId);
        if (c == null) {
            result.completeExceptionally(new IllegalArgumentException("no such Connection: " + connectionId));
            return result;
        }
        c.send(envelope).addListener(f -> {
            if (f.isSuccess()) {
                result.complete(null);
            }
            else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }

    @Override
    public boolean isUserConnected(String userId) {
        return registry.isUserConnected(userId);
    }

    @Override
    public void register(String type, EventHandler handler) {
        dispatcher.register(type, handler);
    }

    @Override
    public void unregister(String type) {
        dispatcher.unregister(type);
    }

    @Override
    public void addSubscriptionListener(SubscriptionListener listener) {
        checkNotNull(listener);
        subscriptionListeners.add(listener);
    }

    @Override
    public DefaultConnectionRegistry registry() {
        return registry;
    }

    @Override
    public void close() {
        log.info("Broker closing, connections: {}", registry.size());
        for (DefaultConnection c : registry.connections()) {
            registry.remove(c.id());
        }
    }

}
