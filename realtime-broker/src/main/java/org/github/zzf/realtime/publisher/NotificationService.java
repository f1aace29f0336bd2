package org.github.zzf.realtime.publisher;

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.Identity;
import org.github.zzf.realtime.protocol.server.Broker;

/**
 * user notifications: live delivery on {@code user:<id>}, the offline channel otherwise
 */
@Slf4j
public class NotificationService {

    public static final String NOTIFICATION = "notification";

    private final Broker broker;
    private final OfflineDeliveryChannel offline;

    public NotificationService(Broker broker, OfflineDeliveryChannel offline) {
        checkNotNull(broker);
        checkNotNull(offline);
        this.broker = broker;
        this.offline = offline;
    }

    /**
     * @return true if delivered to at least one live connection
     */
    public boolean notify(String userId, Object notification) {
        Envelope envelope = Envelope.of(NOTIFICATION, notification);
        if (broker.isUserConnected(userId)
                && broker.publish(Identity.userChannel(userId), envelope) > 0) {
            log.debug("User({}) notified live", userId);
            return true;
        }
        offline.deliver(userId, envelope);
        return false;
    }

    /**
     * system-wide announcement
     *
     * @param role only connections whose identity has the role, null for every connection
     * @return number of deliveries attempted
     */
    public int announce(Envelope envelope, @Nullable String role) {
        if (role == null) {
            return broker.broadcast(envelope);
        }
        return broker.broadcast(envelope, c -> c.identity() != null && c.identity().hasRole(role));
    }

}
