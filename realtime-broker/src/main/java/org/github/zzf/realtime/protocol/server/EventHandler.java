package org.github.zzf.realtime.protocol.server;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * Handles one inbound message type. A thrown exception or a failed stage is reported to the sender as
 * {@code handler_error} carrying the original requestId.
 */
@FunctionalInterface
public interface EventHandler {

    CompletionStage<?> handle(Connection connection, Envelope envelope) throws Exception;

    static EventHandler of(SyncEventHandler handler) {
        return (connection, envelope) -> {
            handler.handle(connection, envelope);
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface SyncEventHandler {

        void handle(Connection connection, Envelope envelope) throws Exception;

    }

}
