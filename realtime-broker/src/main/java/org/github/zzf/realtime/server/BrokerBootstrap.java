package org.github.zzf.realtime.server;

import static com.google.common.base.Preconditions.checkNotNull;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.EventExecutorGroup;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.net.ssl.SSLException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.server.codec.websocket.EnvelopeOverSecureWebsocketServerInitializer;
import org.github.zzf.realtime.server.codec.websocket.EnvelopeOverWebsocketServerInitializer;

@Slf4j
public class BrokerBootstrap implements AutoCloseable {

    private final Map<String, ListenPort> LISTENED_SERVERS = new LinkedHashMap<>(4);

    private final Authenticator authenticator;
    private final BrokerConfig config;
    private final Clock clock;

    private EventExecutorGroup handlerExecutor;
    private EventExecutor heartbeatExecutor;
    private DefaultBroker broker;
    private HeartbeatMonitor heartbeatMonitor;

    @Builder
    public BrokerBootstrap(Authenticator authenticator, BrokerConfig config, Clock clock) {
        checkNotNull(authenticator);
        this.authenticator = authenticator;
        this.config = config == null ? BrokerConfig.builder().build() : config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @SneakyThrows
    public synchronized BrokerBootstrap start() {
        if (broker != null) {
            return this;
        }
        log.info("BrokerBootstrap starting -> {}", config);
        handlerExecutor = new DefaultEventExecutorGroup(config.getHandlerThreadNum(), new DefaultThreadFactory("event-handler"));
        heartbeatExecutor = new DefaultEventExecutor(new DefaultThreadFactory("heartbeat"));
        // ws / wss use the same Broker
        broker = new DefaultBroker(new DefaultConnectionRegistry(authenticator, clock), handlerExecutor,
                config.getHandshakeTimeoutMillis());
        heartbeatMonitor = new HeartbeatMonitor(broker.registry(), heartbeatExecutor, clock,
                config.getHeartbeatIntervalMillis(), config.getConnectionTimeoutMillis()).start();
        /* ["ws://host:port", "wss://host:port"] */
        String[] addressList = config.getListenedAddress().split(",");
        for (String address : addressList) {
            URI uri = new URI(address.trim());
            InetSocketAddress bindAddress = new InetSocketAddress(uri.getHost(), uri.getPort());
            Channel channel;
            switch (uri.getScheme()) {
                case "ws":
                    channel = websocketServer(bindAddress, null);
                    LISTENED_SERVERS.put("ws", new ListenPort(address, channel));
                    break;
                case "wss":
                    channel = websocketServer(bindAddress, sslContext());
                    LISTENED_SERVERS.put("wss", new ListenPort(address, channel));
                    break;
                default:
                    throw new UnsupportedOperationException("Unsupported Schema: " + uri.getScheme());
            }
        }
        return this;
    }

    /**
     * register a JVM shutdown hook that closes the server
     */
    public BrokerBootstrap closeOnShutdown() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::close, "broker-shutdown"));
        return this;
    }

    public Broker broker() {
        checkNotNull(broker, "BrokerBootstrap is not started");
        return broker;
    }

    public HeartbeatMonitor heartbeatMonitor() {
        return heartbeatMonitor;
    }

    /**
     * the address a scheme is bound to, useful when the configured port is 0
     */
    public InetSocketAddress listenedAddress(String scheme) {
        ListenPort port = LISTENED_SERVERS.get(scheme);
        checkNotNull(port, "no server listened for scheme: %s", scheme);
        return (InetSocketAddress) port.getChannel().localAddress();
    }

    private SslContext sslContext() throws SSLException {
        InputStream cert = ClassLoader.getSystemResourceAsStream(config.getSslCertPath());
        InputStream key = ClassLoader.getSystemResourceAsStream(config.getSslKeyPath());
        checkNotNull(cert, "ssl cert not found: %s", config.getSslCertPath());
        checkNotNull(key, "ssl key not found: %s", config.getSslKeyPath());
        return SslContextBuilder.forServer(cert, key).build();
    }

    private Channel websocketServer(InetSocketAddress address, SslContext sslCtx) {
        String name = sslCtx == null ? "ws" : "wss";
        NioEventLoopGroup bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory(name + "-boss"));
        NioEventLoopGroup workerGroup = new NioEventLoopGroup(config.getWorkerThreadNum(), new DefaultThreadFactory(name + "-worker"));
        ChannelInitializer<SocketChannel> initializer = sslCtx == null
                ? new EnvelopeOverWebsocketServerInitializer(config.getWebsocketPath(), broker, config.getMaxMessageSize())
                : new EnvelopeOverSecureWebsocketServerInitializer(config.getWebsocketPath(), sslCtx, broker, config.getMaxMessageSize());
        try {
            ChannelFuture future = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.DEBUG))
                    .childHandler(initializer)
                    .bind(address).sync();
            log.info("{} server listened at {}{}", name, future.channel().localAddress(), config.getWebsocketPath());
            future.channel().closeFuture().addListener(f -> {
                bossGroup.shutdownGracefully();
                workerGroup.shutdownGracefully();
                log.info("{} server was shutdown.", name);
            });
            return future.channel();
        } catch (Exception e) {
            log.info("{} server was shutdown.", name, e);
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
            throw new RuntimeException(e);
        }
    }

    @SneakyThrows
    public void closeListenedPort() {
        // first shutdown the listened servers
        for (Map.Entry<String, ListenPort> e : LISTENED_SERVERS.entrySet()) {
            log.info("Shutdown Server... -> {}", e.getValue());
            e.getValue().getChannel().close().sync().addListener(f -> {
                if (f.isSuccess()) {
                    log.info("Server Shutdown Success: -> {}", e.getValue());
                }
                else {
                    log.error("Server Shutdown Failed: -> {}", e.getValue());
                }
            });
        }
        LISTENED_SERVERS.clear();
    }

    @Override
    public synchronized void close() {
        if (broker == null) {
            return;
        }
        closeListenedPort();
        heartbeatMonitor.close();
        broker.close();
        heartbeatExecutor.shutdownGracefully();
        handlerExecutor.shutdownGracefully();
        broker = null;
        log.info("BrokerBootstrap closed");
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ListenPort {

        // ws://host:port
        private String url;
        private Channel channel;

    }

}
