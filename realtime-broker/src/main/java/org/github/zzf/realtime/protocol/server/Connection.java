package org.github.zzf.realtime.protocol.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import java.net.SocketAddress;
import java.util.Set;
import javax.annotation.Nullable;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.Identity;

/**
 * One live client socket. Owned by the {@link ConnectionRegistry}; the channel set is mutated only by the
 * {@link Broker}.
 */
public interface Connection {

    /**
     * unique id of the connection, sent to the client in {@code connection:established}
     *
     * @return connection id
     */
    String id();

    /**
     * the transport the connection is bound to
     *
     * @return Channel
     */
    Channel channel();

    @Nullable
    SocketAddress remoteAddress();

    /**
     * the verified principal
     *
     * @return null before a successful handshake
     */
    @Nullable
    Identity identity();

    default boolean authenticated() {
        return identity() != null;
    }

    /**
     * the channels the connection is subscribed to
     *
     * @return a read-only view
     */
    Set<String> channels();

    boolean subscribed(String channel);

    long connectedAt();

    long lastActivityAt();

    /**
     * record inbound activity (any frame, including pong)
     */
    void touch();

    /**
     * send a message to peer
     *
     * @param envelope message
     */
    ChannelFuture send(Envelope envelope);

    /**
     * send a transport-level ping frame
     */
    ChannelFuture ping();

    boolean isActive();

}
