package org.github.zzf.realtime.client;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler.ClientHandshakeStateEvent;
import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.model.Envelope;

/**
 * completes the connect future once the WebSocket handshake is done, then relays inbound envelopes
 */
@Slf4j
@RequiredArgsConstructor
public class ClientSessionHandler extends ChannelInboundHandlerAdapter {

    public static final String HANDLER_NAME = ClientSessionHandler.class.getSimpleName();

    private final Connector.Listener listener;
    private final CompletableFuture<Transport> connected;

    private Throwable cause;

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            log.debug("Channel({}) WebSocket handshake complete", ctx.channel());
            connected.complete(new NettyTransport(ctx.channel()));
        }
        else if (evt == ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            connected.completeExceptionally(new IllegalStateException("WebSocket handshake timeout"));
            ctx.close();
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (msg instanceof Envelope envelope) {
            listener.onEnvelope(envelope);
        }
        else {
            super.channelRead(ctx, msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.debug("Channel({}) channelInactive", ctx.channel());
        if (!connected.isDone()) {
            connected.completeExceptionally(cause != null ? cause : new ClosedChannelException());
        }
        else if (!connected.isCompletedExceptionally()) {
            listener.onClosed(cause);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Channel({}) exceptionCaught, now close it", ctx.channel(), cause);
        this.cause = cause;
        ctx.close();
    }

}
