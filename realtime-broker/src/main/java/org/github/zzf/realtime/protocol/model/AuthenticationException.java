package org.github.zzf.realtime.protocol.model;

/**
 * missing, invalid or expired credential
 */
public class AuthenticationException extends Exception {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }

}
