package org.github.zzf.realtime.protocol.server;

import org.github.zzf.realtime.protocol.model.AuthenticationException;
import org.github.zzf.realtime.protocol.model.Identity;

public interface Authenticator {

    /**
     * verify a bearer credential
     *
     * @param credential the token from {@code auth:authenticate} or the {@code token} query parameter, may be null
     * @return the verified identity
     * @throws AuthenticationException missing, invalid or expired credential
     */
    Identity authenticate(String credential) throws AuthenticationException;

}
