package org.github.zzf.realtime.server;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * server settings, read from system properties by {@link #fromSystemProperties()}
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "jwtSecret")
public class BrokerConfig {

    /* ws://host:port,wss://host:port */
    @Builder.Default
    private final String listenedAddress = "ws://0.0.0.0:8080";
    @Builder.Default
    private final String websocketPath = "/ws";
    @Builder.Default
    private final int workerThreadNum = Runtime.getRuntime().availableProcessors() * 2;
    @Builder.Default
    private final int handlerThreadNum = Runtime.getRuntime().availableProcessors();
    @Builder.Default
    private final long heartbeatIntervalMillis = 25_000L;
    @Builder.Default
    private final long connectionTimeoutMillis = 30_000L;
    /* 0 disables the handshake timeout */
    @Builder.Default
    private final long handshakeTimeoutMillis = 0L;
    @Builder.Default
    private final int maxMessageSize = 1024 * 1024;
    @Nullable
    private final String jwtSecret;
    @Builder.Default
    private final String sslCertPath = "cert/server.pem";
    @Builder.Default
    private final String sslKeyPath = "cert/server.pkcs8.key";

    public static BrokerConfig fromSystemProperties() {
        BrokerConfig d = BrokerConfig.builder().build();
        return BrokerConfig.builder()
                .listenedAddress(System.getProperty("realtime.server.listened.address", d.listenedAddress))
                .websocketPath(System.getProperty("realtime.server.ws.path", d.websocketPath))
                .workerThreadNum(Integer.getInteger("realtime.server.thread.num", d.workerThreadNum))
                .handlerThreadNum(Integer.getInteger("realtime.server.handler.thread.num", d.handlerThreadNum))
                .heartbeatIntervalMillis(Long.getLong("realtime.server.heartbeat.interval.millis", d.heartbeatIntervalMillis))
                .connectionTimeoutMillis(Long.getLong("realtime.server.connection.timeout.millis", d.connectionTimeoutMillis))
                .handshakeTimeoutMillis(Long.getLong("realtime.server.handshake.timeout.millis", d.handshakeTimeoutMillis))
                .maxMessageSize(Integer.getInteger("realtime.server.max.message.size", d.maxMessageSize))
                .jwtSecret(System.getProperty("realtime.jwt.secret"))
                .sslCertPath(System.getProperty("realtime.server.ssl.cert", d.sslCertPath))
                .sslKeyPath(System.getProperty("realtime.server.ssl.key", d.sslKeyPath))
                .build();
    }

}
