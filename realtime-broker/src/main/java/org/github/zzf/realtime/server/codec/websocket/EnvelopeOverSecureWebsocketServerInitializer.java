package org.github.zzf.realtime.server.codec.websocket;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.ssl.SslContext;
import lombok.RequiredArgsConstructor;
import org.github.zzf.realtime.protocol.server.Broker;

@RequiredArgsConstructor
public class EnvelopeOverSecureWebsocketServerInitializer extends ChannelInitializer<SocketChannel> {

    private final String websocketPath;
    private final SslContext sslCtx;
    private final Broker broker;
    private final int maxMessageSize;

    @Override
    protected void initChannel(SocketChannel ch) {
        // SSL
        ch.pipeline().addFirst(sslCtx.newHandler(ch.alloc()));
        EnvelopeOverWebsocketServerInitializer.addWebsocketHandlers(ch.pipeline(), websocketPath, broker, maxMessageSize);
    }

}
