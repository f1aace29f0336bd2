package org.github.zzf.realtime.protocol.server;

import io.netty.channel.Channel;
import java.util.Collection;
import java.util.List;
import javax.annotation.Nullable;
import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Identity;

/**
 * The set of live connections of this process.
 */
public interface ConnectionRegistry {

    /**
     * register a new unauthenticated connection bound to the transport
     *
     * @param channel transport
     * @return the new Connection, subscribed to the public channel
     */
    Connection accept(Channel channel);

    /**
     * verify the credential and attach the identity to the connection
     *
     * @throws AuthenticationException the credential was rejected
     * @throws IllegalArgumentException no such connection
     */
    Identity authenticate(String connectionId, String credential) throws AuthenticationException;

    /**
     * unregister the connection, cancel its timers and close its transport. idempotent.
     *
     * @return false if the connection was already gone
     */
    boolean remove(String connectionId);

    @Nullable
    Connection connection(String connectionId);

    /**
     * weakly consistent view of every live connection
     */
    Collection<? extends Connection> connections();

    List<Connection> userConnections(String userId);

    /**
     * presence query
     */
    boolean isUserConnected(String userId);

    int size();

}
