package org.github.zzf.realtime.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Objects;

/**
 * the verified principal attached to a Connection after a successful handshake
 */
public final class Identity {

    public static final String USER_CHANNEL_PREFIX = "user:";

    private final String userId;
    private final List<String> roles;

    public Identity(String userId, List<String> roles) {
        checkNotNull(userId);
        checkArgument(!userId.isEmpty(), "userId is empty");
        this.userId = userId;
        this.roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public String userId() {
        return userId;
    }

    public List<String> roles() {
        return roles;
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    public boolean hasAnyRole(String... candidates) {
        for (String r : candidates) {
            if (hasRole(r)) {
                return true;
            }
        }
        return false;
    }

    /**
     * the per-user channel every authenticated connection is subscribed to
     */
    public String userChannel() {
        return userChannel(userId);
    }

    public static String userChannel(String userId) {
        return USER_CHANNEL_PREFIX + userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity that)) {
            return false;
        }
        return userId.equals(that.userId) && roles.equals(that.roles);
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, roles);
    }

    @Override
    public String toString() {
        return "{\"userId\":\"" + userId + "\",\"roles\":" + roles + "}";
    }

}
