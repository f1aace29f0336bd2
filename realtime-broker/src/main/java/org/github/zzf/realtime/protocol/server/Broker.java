package org.github.zzf.realtime.protocol.server;

import io.netty.channel.Channel;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * Channel based publish/subscribe over the {@link ConnectionRegistry}.
 */
public interface Broker extends AutoCloseable {

    /**
     * the transport finished its upgrade; register it and greet the client
     */
    Connection accept(Channel channel);

    /**
     * run the handshake for the connection. A rejected credential sends {@code authentication_failed}
     * then closes and removes the connection.
     *
     * @return true if the connection is authenticated afterwards
     */
    boolean authenticate(String connectionId, String credential);

    /**
     * an inbound message from the connection
     */
    void onEnvelope(Connection connection, Envelope envelope);

    /**
     * the transport of the connection is gone
     */
    void disconnect(String connectionId);

    /**
     * idempotent; acknowledged with {@code channel:subscribed}
     *
     * @return true if the channel was newly added
     */
    boolean subscribe(String connectionId, String channel);

    /**
     * idempotent; acknowledged with {@code channel:unsubscribed}
     *
     * @return true if the channel was removed
     */
    boolean unsubscribe(String connectionId, String channel);

    /**
     * deliver the envelope to every connection subscribed to the channel
     *
     * @return number of deliveries attempted
     */
    int publish(String channel, Envelope envelope);

    /**
     * deliver the envelope to every connection
     *
     * @return number of deliveries attempted
     */
    default int broadcast(Envelope envelope) {
        return broadcast(envelope, c -> true);
    }

    /**
     * deliver the envelope to every connection the filter accepts
     *
     * @return number of deliveries attempted
     */
    int broadcast(Envelope envelope, Predicate<Connection> filter);

    /**
     * unicast
     *
     * @return completes when the envelope is written; fails if the connection is unknown or the write fails
     */
    CompletableFuture<Void> send(String connectionId, Envelope envelope);

    boolean isUserConnected(String userId);

    /**
     * register the handler for an application message type, replacing any previous one
     */
    void register(String type, EventHandler handler);

    void unregister(String type);

    /**
     * called after every acknowledged subscribe, on the thread that ran it
     */
    void addSubscriptionListener(SubscriptionListener listener);

    ConnectionRegistry registry();

    /**
     * close every connection
     */
    @Override
    void close();

}
