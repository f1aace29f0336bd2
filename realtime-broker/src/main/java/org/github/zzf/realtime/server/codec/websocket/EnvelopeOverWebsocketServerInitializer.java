package org.github.zzf.realtime.server.codec.websocket;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketDecoderConfig;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import lombok.RequiredArgsConstructor;
import org.github.zzf.realtime.protocol.codec.EnvelopeCodec;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.server.DefaultServerSessionHandler;

@RequiredArgsConstructor
public class EnvelopeOverWebsocketServerInitializer extends ChannelInitializer<SocketChannel> {

    private static final EnvelopeCodec ENVELOPE_CODEC = new EnvelopeCodec();

    private final String websocketPath;
    private final Broker broker;
    private final int maxMessageSize;

    @Override
    protected void initChannel(SocketChannel ch) {
        addWebsocketHandlers(ch.pipeline(), websocketPath, broker, maxMessageSize);
    }

    static void addWebsocketHandlers(ChannelPipeline pipeline, String websocketPath, Broker broker, int maxMessageSize) {
        WebSocketServerProtocolConfig config = WebSocketServerProtocolConfig.newBuilder()
                .websocketPath(websocketPath)
                // ws://host:port/ws?token=xxx
                .checkStartsWith(true)
                // pong frames count as activity
                .dropPongFrames(false)
                .decoderConfig(WebSocketDecoderConfig.newBuilder()
                        .maxFramePayloadLength(maxMessageSize)
                        .allowExtensions(true)
                        .build())
                .build();
        pipeline
                // http handler
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(65536))
                // websocket handler
                .addLast(new WebSocketServerCompressionHandler())
                .addLast(new WebSocketServerProtocolHandler(config))
                .addLast(new WebSocketFrameAggregator(maxMessageSize))
                // inbound:     TextWebSocketFrame -> Envelope
                // outbound:    Envelope -> TextWebSocketFrame
                .addLast(EnvelopeCodec.HANDLER_NAME, ENVELOPE_CODEC)
                .addLast(DefaultServerSessionHandler.HANDLER_NAME, new DefaultServerSessionHandler(broker))
        ;
    }

}
