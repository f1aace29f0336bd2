package org.github.zzf.realtime.client;

import org.github.zzf.realtime.client.ConnectionManager.State;
import org.github.zzf.realtime.protocol.model.Envelope;

public interface ConnectionListener {

    default void onEnvelope(Envelope envelope) {
    }

    default void onStateChanged(State from, State to) {
    }

}
