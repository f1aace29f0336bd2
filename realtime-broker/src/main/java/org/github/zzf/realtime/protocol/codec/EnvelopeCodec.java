package org.github.zzf.realtime.protocol.codec;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * inbound:     TextWebSocketFrame -> Envelope
 * <p>
 * outbound:    Envelope -> TextWebSocketFrame
 * <p>
 * Ping / Pong / Close frames pass through untouched. A frame that can not be decoded fails with a
 * {@link io.netty.handler.codec.DecoderException} caused by {@link MalformedEnvelopeException}.
 */
@Slf4j
@Sharable
public class EnvelopeCodec extends MessageToMessageCodec<WebSocketFrame, Envelope> {

    public static final String HANDLER_NAME = EnvelopeCodec.class.getSimpleName();

    @Override
    public boolean acceptInboundMessage(Object msg) {
        return msg instanceof TextWebSocketFrame || msg instanceof BinaryWebSocketFrame;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Envelope msg, List<Object> out) {
        String json = toJson(msg);
        log.debug("Channel({}) send -> {}", ctx.channel().id(), json);
        out.add(new TextWebSocketFrame(json));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, WebSocketFrame msg, List<Object> out) throws Exception {
        if (!(msg instanceof TextWebSocketFrame text)) {
            throw new MalformedEnvelopeException("binary frames are not supported");
        }
        String json = text.text();
        log.debug("Channel({}) receive <- {}", ctx.channel().id(), json);
        out.add(fromJson(json));
    }

    public static String toJson(Envelope envelope) {
        JSONObject jo = new JSONObject(true);
        jo.put("type", envelope.type());
        jo.put("data", envelope.data());
        if (envelope.requestId() != null) {
            jo.put("requestId", envelope.requestId());
        }
        jo.put("timestamp", envelope.timestamp());
        if (envelope.channel() != null) {
            jo.put("channel", envelope.channel());
        }
        return JSON.toJSONString(jo);
    }

    public static Envelope fromJson(String json) throws MalformedEnvelopeException {
        Object parsed;
        try {
            parsed = JSON.parse(json);
        } catch (JSONException e) {
            throw new MalformedEnvelopeException("not a JSON document", e);
        }
        if (!(parsed instanceof JSONObject jo)) {
            throw new MalformedEnvelopeException("not a JSON object");
        }
        if (!(jo.get("type") instanceof String type) || type.isEmpty()) {
            throw new MalformedEnvelopeException("type is missing");
        }
        Object requestId = jo.get("requestId");
        Object channel = jo.get("channel");
        long timestamp = jo.get("timestamp") instanceof Number n ? n.longValue() : System.currentTimeMillis();
        return new Envelope(type, jo.get("data"),
                requestId == null ? null : requestId.toString(),
                timestamp,
                channel == null ? null : channel.toString());
    }

}
