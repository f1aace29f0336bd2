package org.github.zzf.realtime.publisher;

import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;

@Slf4j
public class LoggingOfflineDeliveryChannel implements OfflineDeliveryChannel {

    @Override
    public void deliver(String userId, Envelope notification) {
        log.info("User({}) is offline, notification kept for an offline channel -> {}", userId, notification);
    }

}
