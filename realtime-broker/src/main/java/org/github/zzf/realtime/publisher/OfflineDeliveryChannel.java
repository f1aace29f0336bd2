package org.github.zzf.realtime.publisher;

import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * where notifications go when the user has no live connection (email, push, ...)
 */
@FunctionalInterface
public interface OfflineDeliveryChannel {

    void deliver(String userId, Envelope notification);

}
