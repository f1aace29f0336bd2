package org.github.zzf.realtime.client;

import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * an established socket to the server
 */
public interface Transport {

    /**
     * write the envelope; ordering is preserved per transport
     */
    void send(Envelope envelope);

    void close();

    boolean isOpen();

}
