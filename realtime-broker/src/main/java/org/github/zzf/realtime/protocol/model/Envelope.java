package org.github.zzf.realtime.protocol.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The unit exchanged on the socket in both directions.
 * <pre>
 * { "type": string, "data": any, "requestId"?: string, "timestamp": ms, "channel"?: string }
 * </pre>
 * Immutable. {@code data} holds a JSON value (JSONObject, JSONArray, String, Number, Boolean or null).
 */
public final class Envelope {

    private final String type;
    @Nullable
    private final Object data;
    @Nullable
    private final String requestId;
    private final long timestamp;
    @Nullable
    private final String channel;

    public Envelope(String type, @Nullable Object data, @Nullable String requestId, long timestamp,
            @Nullable String channel) {
        checkNotNull(type);
        checkArgument(!type.isEmpty(), "type is empty");
        this.type = type;
        this.data = data;
        this.requestId = requestId;
        this.timestamp = timestamp;
        this.channel = channel;
    }

    public static Envelope of(String type, @Nullable Object data) {
        return of(type, data, null);
    }

    public static Envelope of(String type, @Nullable Object data, @Nullable String requestId) {
        return new Envelope(type, data, requestId, System.currentTimeMillis(), null);
    }

    public static Envelope of(MessageType type, @Nullable Object data) {
        return of(type.type(), data, null);
    }

    public static Envelope of(MessageType type, @Nullable Object data, @Nullable String requestId) {
        return of(type.type(), data, requestId);
    }

    public static Envelope error(ErrorCode code, String message, @Nullable String requestId) {
        JSONObject data = new JSONObject(true);
        data.put("code", code.code());
        data.put("message", message);
        return of(MessageType.ERROR, data, requestId);
    }

    public String type() {
        return type;
    }

    @Nullable
    public Object data() {
        return data;
    }

    @Nullable
    public String requestId() {
        return requestId;
    }

    public long timestamp() {
        return timestamp;
    }

    @Nullable
    public String channel() {
        return channel;
    }

    public boolean is(MessageType messageType) {
        return messageType.type().equals(type);
    }

    /**
     * copy of this envelope tagged with the channel it was published on
     */
    public Envelope withChannel(String channel) {
        return new Envelope(type, data, requestId, timestamp, channel);
    }

    public Envelope withTimestamp(long timestamp) {
        return new Envelope(type, data, requestId, timestamp, channel);
    }

    /**
     * data as a JSON object
     *
     * @return null if data is not an object
     */
    @Nullable
    public JSONObject dataAsObject() {
        if (data instanceof JSONObject jo) {
            return jo;
        }
        if (data instanceof Map<?, ?> map) {
            JSONObject jo = new JSONObject(true);
            for (Map.Entry<?, ?> e : map.entrySet()) {
                jo.put(String.valueOf(e.getKey()), e.getValue());
            }
            return jo;
        }
        return null;
    }

    @Nullable
    public String dataString(String key) {
        JSONObject jo = dataAsObject();
        return jo == null ? null : jo.getString(key);
    }

    /**
     * the error code of an {@code error} envelope
     *
     * @return null if this is not an error envelope or the code is missing
     */
    @Nullable
    public String errorCode() {
        return is(MessageType.ERROR) ? dataString("code") : null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        sb.append("\"type\":\"").append(type).append('\"').append(',');
        sb.append("\"data\":").append(JSON.toJSONString(data)).append(',');
        if (requestId != null) {
            sb.append("\"requestId\":\"").append(requestId).append('\"').append(',');
        }
        if (channel != null) {
            sb.append("\"channel\":\"").append(channel).append('\"').append(',');
        }
        sb.append("\"timestamp\":").append(timestamp);
        return sb.append('}').toString();
    }

}
