package org.github.zzf.realtime.protocol.model;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Built-in control message types. Application types (order:location, ...) are plain strings
 * registered in the dispatch table.
 */
public enum MessageType {

    /* client -> server */
    AUTHENTICATE("auth:authenticate", true),
    SUBSCRIBE("channel:subscribe", true),
    UNSUBSCRIBE("channel:unsubscribe", true),
    PING("ping", true),

    /* server -> client */
    CONNECTION_ESTABLISHED("connection:established", false),
    AUTHENTICATED("auth:authenticated", false),
    SUBSCRIBED("channel:subscribed", false),
    UNSUBSCRIBED("channel:unsubscribed", false),
    PONG("pong", false),
    ERROR("error", false),
    ;

    public static final String HANDSHAKE_PREFIX = "auth:";

    private static final Map<String, MessageType> INBOUND = new HashMap<>(8);

    static {
        for (MessageType t : values()) {
            if (t.inbound) {
                INBOUND.put(t.type, t);
            }
        }
    }

    private final String type;
    private final boolean inbound;

    MessageType(String type, boolean inbound) {
        this.type = type;
        this.inbound = inbound;
    }

    public String type() {
        return type;
    }

    public boolean inbound() {
        return inbound;
    }

    /**
     * the control type a client may send
     *
     * @param type wire type
     * @return null if the type is not a built-in inbound control type
     */
    @Nullable
    public static MessageType inbound(String type) {
        return INBOUND.get(type);
    }

    /**
     * every type except the handshake types needs an authenticated connection
     */
    public static boolean requiresAuthentication(String type) {
        return !type.startsWith(HANDSHAKE_PREFIX);
    }

}
