package org.github.zzf.realtime.protocol.server;

@FunctionalInterface
public interface SubscriptionListener {

    /**
     * the connection is subscribed to the channel, either newly or again
     */
    void subscribed(Connection connection, String channel);

}
