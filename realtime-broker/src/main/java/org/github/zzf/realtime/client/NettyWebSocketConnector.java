package org.github.zzf.realtime.client;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import javax.net.ssl.SSLException;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.codec.EnvelopeCodec;

/**
 * ws:// and wss:// transports built on a Netty {@link Bootstrap}
 */
@Slf4j
public class NettyWebSocketConnector implements Connector {

    private static final EnvelopeCodec ENVELOPE_CODEC = new EnvelopeCodec();

    private final URI uri;
    private final EventLoopGroup eventLoopGroup;
    private final int maxMessageSize;
    private final SslContext sslCtx;

    public NettyWebSocketConnector(URI uri, EventLoopGroup eventLoopGroup) {
        this(uri, eventLoopGroup, 1024 * 1024);
    }

    public NettyWebSocketConnector(URI uri, EventLoopGroup eventLoopGroup, int maxMessageSize) {
        checkNotNull(uri);
        checkNotNull(eventLoopGroup);
        checkArgument("ws".equals(uri.getScheme()) || "wss".equals(uri.getScheme()),
                "Unsupported Schema: %s", uri.getScheme());
        this.uri = uri;
        this.eventLoopGroup = eventLoopGroup;
        this.maxMessageSize = maxMessageSize;
        try {
            this.sslCtx = "wss".equals(uri.getScheme()) ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public CompletionStage<Transport> connect(Listener listener) {
        CompletableFuture<Transport> connected = new CompletableFuture<>();
        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxMessageSize);
        int port = uri.getPort() != -1 ? uri.getPort() : (sslCtx == null ? 80 : 443);
        new Bootstrap()
                .group(eventLoopGroup)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        if (sslCtx != null) {
                            p.addLast(sslCtx.newHandler(ch.alloc(), uri.getHost(), port));
                        }
                        p.addLast(new HttpClientCodec())
                                .addLast(new HttpObjectAggregator(65536))
                                .addLast(new WebSocketClientProtocolHandler(handshaker))
                                .addLast(new WebSocketFrameAggregator(maxMessageSize))
                                .addLast(EnvelopeCodec.HANDLER_NAME, ENVELOPE_CODEC)
                                .addLast(ClientSessionHandler.HANDLER_NAME, new ClientSessionHandler(listener, connected));
                    }
                })
                .connect(uri.getHost(), port)
                .addListener(ChannelFutureListener.CLOSE_ON_FAILURE)
                .addListener(f -> {
                    if (!f.isSuccess()) {
                        log.debug("connect to {} failed", uri, f.cause());
                        connected.completeExceptionally(f.cause());
                    }
                });
        return connected;
    }

}
