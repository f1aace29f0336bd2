package org.github.zzf.realtime.client;

import java.util.concurrent.CompletionStage;
import javax.annotation.Nullable;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * opens transports to one server endpoint
 */
public interface Connector {

    /**
     * open a new transport
     *
     * @param listener receives inbound envelopes and the close of the transport
     * @return completes with the transport once it can carry envelopes
     */
    CompletionStage<Transport> connect(Listener listener);

    interface Listener {

        void onEnvelope(Envelope envelope);

        /**
         * the transport is gone
         *
         * @param cause null on an orderly close
         */
        void onClosed(@Nullable Throwable cause);

    }

}
