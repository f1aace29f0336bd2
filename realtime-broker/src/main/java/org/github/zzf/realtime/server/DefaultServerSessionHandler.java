package org.github.zzf.realtime.server;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler.HandshakeComplete;
import io.netty.util.ReferenceCountUtil;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.codec.MalformedEnvelopeException;
import org.github.zzf.realtime.protocol.model.Envelope;
import org.github.zzf.realtime.protocol.model.ErrorCode;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.protocol.server.Connection;

/**
 * Binds one WebSocket to a {@link Connection}: registers it once the upgrade completes, feeds inbound
 * envelopes to the {@link Broker} and unregisters it when the channel goes inactive.
 */
@Slf4j
@RequiredArgsConstructor
public class DefaultServerSessionHandler extends ChannelInboundHandlerAdapter {

    public static final String HANDLER_NAME = DefaultServerSessionHandler.class.getSimpleName();
    public static final String TOKEN_QUERY_PARAM = "token";

    private final Broker broker;
    protected Connection connection;

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof HandshakeComplete hc) {
            upgraded(ctx, hc.requestUri());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    void upgraded(ChannelHandlerContext ctx, String requestUri) {
        if (connection != null) {
            log.error("Connection({}) upgraded twice, now close channel", cid());
            ctx.channel().close();
            return;
        }
        connection = broker.accept(ctx.channel());
        String token = queryToken(requestUri);
        if (token != null) {
            log.debug("Connection({}) carries a token on the upgrade request", cid());
            broker.authenticate(connection.id(), token);
        }
    }

    static String queryToken(String requestUri) {
        List<String> values = new QueryStringDecoder(requestUri).parameters().get(TOKEN_QUERY_PARAM);
        if (values == null || values.isEmpty() || values.get(0).isEmpty()) {
            return null;
        }
        return values.get(0);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (connection == null) {
            log.error("channelRead before the WebSocket upgrade completed, now close channel -> {}", ctx.channel());
            ReferenceCountUtil.release(msg);
            ctx.channel().close();
            return;
        }
        if (msg instanceof Envelope envelope) {
            connection.touch();
            broker.onEnvelope(connection, envelope);
        }
        else if (msg instanceof PongWebSocketFrame) {
            connection.touch();
            ReferenceCountUtil.release(msg);
        }
        else {
            ctx.fireChannelRead(msg);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (connection != null
                && cause instanceof DecoderException
                && cause.getCause() instanceof MalformedEnvelopeException e) {
            log.warn("Connection({}) sent a malformed frame -> {}", cid(), e.getMessage());
            connection.touch();
            connection.send(Envelope.error(ErrorCode.INTERNAL_ERROR, "Invalid message format", null));
            return;
        }
        log.error("Connection({}) exceptionCaught. now close the channel -> {}", cid(), ctx.channel(), cause);
        ctx.channel().close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Connection({}) channelInactive", cid());
        if (connection != null) {
            broker.disconnect(connection.id());
        }
        super.channelInactive(ctx);
    }

    private String cid() {
        return Optional.ofNullable(connection).map(Connection::id).orElse(null);
    }

}
