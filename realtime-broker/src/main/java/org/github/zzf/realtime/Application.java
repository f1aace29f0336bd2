package org.github.zzf.realtime;

import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.publisher.LoggingOfflineDeliveryChannel;
import org.github.zzf.realtime.publisher.NotificationService;
import org.github.zzf.realtime.publisher.OrderTrackingService;
import org.github.zzf.realtime.server.BrokerBootstrap;
import org.github.zzf.realtime.server.BrokerConfig;
import org.github.zzf.realtime.server.JwtAuthenticator;
import org.github.zzf.realtime.server.metric.MicroMeterMetrics;

@Slf4j
public class Application {

    public static void main(String[] args) {
        BrokerConfig config = BrokerConfig.fromSystemProperties();
        log.info("realtime.server config: {}", config);
        if (config.getJwtSecret() == null) {
            log.error("realtime.jwt.secret is required");
            System.exit(1);
        }
        BrokerBootstrap bootstrap = BrokerBootstrap.builder()
                .authenticator(new JwtAuthenticator(config.getJwtSecret()))
                .config(config)
                .build()
                .start()
                .closeOnShutdown();
        Broker broker = bootstrap.broker();
        new OrderTrackingService(broker,
                Integer.getInteger("realtime.tracking.max.orders", 10_000),
                Integer.getInteger("realtime.tracking.max.positions", 20));
        new NotificationService(broker, new LoggingOfflineDeliveryChannel());
        // metric
        String appName = System.getProperty("appName", "realtime-broker");
        log.info("appName: {}", appName);
        MicroMeterMetrics.builder()
                .appName(appName)
                .prometheusExportAddress(System.getProperty("prometheus.export.address"))
                .build()
                .init();
    }

}
