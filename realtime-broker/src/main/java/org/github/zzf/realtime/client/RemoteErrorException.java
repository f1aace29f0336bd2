package org.github.zzf.realtime.client;

import javax.annotation.Nullable;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * an {@code error} envelope received from the server
 */
public class RemoteErrorException extends RuntimeException {

    private final String code;
    @Nullable
    private final String requestId;

    public RemoteErrorException(String code, String message, @Nullable String requestId) {
        super(code + ": " + message);
        this.code = code;
        this.requestId = requestId;
    }

    public static RemoteErrorException from(Envelope error) {
        String code = error.errorCode();
        return new RemoteErrorException(code == null ? "unknown" : code,
                error.dataString("message"), error.requestId());
    }

    public String code() {
        return code;
    }

    @Nullable
    public String requestId() {
        return requestId;
    }

}
