package org.github.zzf.realtime.protocol.model;

/**
 * codes carried in {@code data.code} of an {@code error} envelope
 */
public enum ErrorCode {

    AUTHENTICATION_REQUIRED("authentication_required"),
    AUTHENTICATION_FAILED("authentication_failed"),
    UNKNOWN_EVENT("unknown_event"),
    HANDLER_ERROR("handler_error"),
    INTERNAL_ERROR("internal_error"),
    INVALID_REQUEST("invalid_request"),
    FORBIDDEN("forbidden"),
    ;

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ErrorCode of(String code) {
        for (ErrorCode e : values()) {
            if (e.code.equals(code)) {
                return e;
            }
        }
        throw new IllegalArgumentException("unknown error code: " + code);
    }

}
