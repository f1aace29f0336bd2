package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.channel.Channel;
import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.ConnectionRegistry;
import org.github.zzf.realtime.server.metric.MetricUtil;

@Slf4j
public class DefaultConnectionRegistry implements ConnectionRegistry {

    public static final String PUBLIC_CHANNEL = "public";

    private final ConcurrentMap<String, DefaultConnection> connections = new ConcurrentHashMap<>();
    private final Authenticator authenticator;
    private final Clock clock;

    public DefaultConnectionRegistry(Authenticator authenticator) {
        this(authenticator, Clock.systemUTC());
    }

    public DefaultConnectionRegistry(Authenticator authenticator, Clock clock) {
        checkNotNull(authenticator);
        checkNotNull(clock);
        this.authenticator = authenticator;
        this.clock = clock;
        MetricUtil.gauge("realtime.server.connections", connections);
    }

    @Override
    public DefaultConnection accept(Channel channel) {
        DefaultConnection c = new DefaultConnection(UUID.randomUUID().toString(), channel, clock);
        c.subscribe(PUBLIC_CHANNEL);
        connections.put(c.id(), c);
        log.info("Connection({}) accepted from {}, total: {}", c.id(), channel.remoteAddress(), connections.size());
        return c;
    }

    @Override
    public Identity authenticate(String connectionId, String credential) throws AuthenticationException {
        DefaultConnection c = connections.get(connectionId);
        checkArgument(c != null, "no such Connection: %s", connectionId);
        Identity identity = authenticator.authenticate(credential);
        if (!c.authenticated(identity)) {
            throw new AuthenticationException("Connection is closed");
        }
        log.info("Connection({}) authenticated as {}", connectionId, identity);
        return identity;
    }

    @Override
    public boolean remove(String connectionId) {
        DefaultConnection c = connections.remove(connectionId);
        if (c == null) {
            return false;
        }
        c.closed();
        log.info("Connection({}) removed, total: {}", connectionId, connections.size());
        return true;
    }

    @Nullable
    @Override
    public DefaultConnection connection(String connectionId) {
        return connections.get(connectionId);
    }

    @Override
    public Collection<DefaultConnection> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    @Override
    public List<Connection> userConnections(String userId) {
        return connections.values().stream()
                .filter(c -> c.identity() != null && c.identity().userId().equals(userId))
                .collect(Collectors.toList());
    }

    @Override
    public boolean isUserConnected(String userId) {
        for (DefaultConnection c : connections.values()) {
            Identity identity = c.identity();
            if (identity != null && identity.userId().equals(userId) && c.isActive()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int size() {
        return connections.size();
    }

}
