package org.github.zzf.realtime.publisher;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSONObject;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.protocol.server.Connection;
import org.github.zzf.realtime.protocol.server.EventHandler;

/**
 * Order status and delivery-partner location on the {@code order:<id>} channels.
 * <p>
 * A connection that subscribes to an order channel is sent the last known status and position of the order
 * right after the subscribe ack.
 */
@Slf4j
public class OrderTrackingService {

    public static final String ORDER_STATUS = "order:status";
    public static final String ORDER_LOCATION = "order:location";
    public static final String ROLE_DELIVERY_PARTNER = "delivery_partner";
    public static final String ROLE_ADMIN = "admin";
    public static final String CHANNEL_PREFIX = "order:";

    private final Broker broker;
    private final int maxPositionsPerOrder;
    // orderId -> last positions, oldest first
    private final Cache<String, Deque<Position>> positions;
    // orderId -> data of the last published status
    private final Cache<String, JSONObject> statuses;

    public OrderTrackingService(Broker broker) {
        this(broker, 10_000, 20);
    }

    public OrderTrackingService(Broker broker, int maxTrackedOrders, int maxPositionsPerOrder) {
        checkNotNull(broker);
        checkArgument(maxTrackedOrders > 0, "maxTrackedOrders must be positive");
        checkArgument(maxPositionsPerOrder > 0, "maxPositionsPerOrder must be positive");
        this.broker = broker;
        this.maxPositionsPerOrder = maxPositionsPerOrder;
        this.positions = CacheBuilder.newBuilder().maximumSize(maxTrackedOrders).build();
        this.statuses = CacheBuilder.newBuilder().maximumSize(maxTrackedOrders).build();
        broker.register(ORDER_LOCATION, EventHandler.of(this::onLocationUpdate));
        broker.addSubscriptionListener(this::onSubscribed);
    }

    public static String channel(String orderId) {
        return CHANNEL_PREFIX + orderId;
    }

    /**
     * @return number of deliveries attempted
     */
    public int publishStatus(String orderId, String status, @Nullable Map<String, Object> metadata) {
        checkNotNull(orderId);
        checkNotNull(status);
        JSONObject data = new JSONObject(true);
        data.put("orderId", orderId);
        data.put("status", status);
        if (metadata != null) {
            data.putAll(metadata);
        }
        statuses.put(orderId, data);
        int delivered = broker.publish(channel(orderId), Envelope.of(ORDER_STATUS, data));
        log.debug("Order({}) status {} published to {} connections", orderId, status, delivered);
        return delivered;
    }

    void onLocationUpdate(Connection connection, Envelope envelope) {
        Identity identity = connection.identity();
        if (identity == null || !identity.hasAnyRole(ROLE_DELIVERY_PARTNER, ROLE_ADMIN)) {
            throw new IllegalStateException("Only delivery partners can update locations");
        }
        JSONObject data = envelope.dataAsObject();
        String orderId = data == null ? null : data.getString("orderId");
        Double lat = data == null ? null : data.getDouble("lat");
        Double lng = data == null ? null : data.getDouble("lng");
        if (orderId == null || orderId.isEmpty() || lat == null || lng == null) {
            throw new IllegalArgumentException("orderId, lat and lng are required");
        }
        updateLocation(orderId, new Position(lat, lng, identity.userId(), envelope.timestamp()));
    }

    /**
     * record the position and publish it to the order channel
     *
     * @return number of deliveries attempted
     */
    public int updateLocation(String orderId, Position position) {
        Deque<Position> history = history(orderId);
        synchronized (history) {
            history.addLast(position);
            while (history.size() > maxPositionsPerOrder) {
                history.removeFirst();
            }
        }
        return broker.publish(channel(orderId), locationEnvelope(orderId, position));
    }

    private static Envelope locationEnvelope(String orderId, Position position) {
        JSONObject partner = new JSONObject(true);
        partner.put("id", position.getPartnerId());
        partner.put("location", position.toJson());
        JSONObject data = new JSONObject(true);
        data.put("orderId", orderId);
        data.put("deliveryPartner", partner);
        data.put("timestamp", position.getTimestamp());
        return Envelope.of(ORDER_LOCATION, data);
    }

    /**
     * replay the current tracking state to a new subscriber of an order channel
     */
    void onSubscribed(Connection connection, String channel) {
        if (!channel.startsWith(CHANNEL_PREFIX) || channel.length() == CHANNEL_PREFIX.length()) {
            return;
        }
        String orderId = channel.substring(CHANNEL_PREFIX.length());
        JSONObject status = statuses.getIfPresent(orderId);
        if (status != null) {
            connection.send(Envelope.of(ORDER_STATUS, status).withChannel(channel));
        }
        Optional<Position> position = latestPosition(orderId);
        position.ifPresent(p -> connection.send(locationEnvelope(orderId, p).withChannel(channel)));
        log.debug("Connection({}) subscribed to order {}, replayed status: {}, position: {}",
                connection.id(), orderId, status != null, position.isPresent());
    }

    /**
     * data of the last status published for the order
     */
    public Optional<JSONObject> lastStatus(String orderId) {
        return Optional.ofNullable(statuses.getIfPresent(orderId));
    }

    private Deque<Position> history(String orderId) {
        try {
            return positions.get(orderId, ArrayDeque::new);
        } catch (ExecutionException e) {
            throw new IllegalStateException(e);
        }
    }

    public Optional<Position> latestPosition(String orderId) {
        Deque<Position> history = positions.getIfPresent(orderId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return Optional.ofNullable(history.peekLast());
        }
    }

    /**
     * @return positions of the order, oldest first
     */
    public List<Position> positions(String orderId) {
        Deque<Position> history = positions.getIfPresent(orderId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public void forget(String orderId) {
        positions.invalidate(orderId);
        statuses.invalidate(orderId);
    }

}
