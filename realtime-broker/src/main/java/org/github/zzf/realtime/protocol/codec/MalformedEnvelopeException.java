package org.github.zzf.realtime.protocol.codec;

/**
 * the frame is not a JSON object with a non-empty {@code type}
 */
public class MalformedEnvelopeException extends Exception {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }

}
