package org.github.zzf.realtime;

import lombok.extern.slf4j.Slf4j;
import org.github.zzf.realtime.protocol.server.Authenticator;
import org.github.zzf.realtime.protocol.server.Broker;
import org.github.zzf.realtime.publisher.LoggingOfflineDeliveryChannel;
import org.github.zzf.realtime.publisher.NotificationService;
import org.github.zzf.realtime.publisher.OfflineDeliveryChannel;
import org.github.zzf.realtime.publisher.OrderTrackingService;
import org.github.zzf.realtime.server.BrokerBootstrap;
import org.github.zzf.realtime.server.BrokerConfig;
import org.github.zzf.realtime.server.JwtAuthenticator;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * the same wiring as {@link Application}, for embedding in a Spring context
 */
@Slf4j
@Configuration
public class RealtimeConfiguration {

    public static void main(String[] args) {
        AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(RealtimeConfiguration.class);
        context.registerShutdownHook();
        log.info("realtime broker started in Spring context -> {}", context.getBean(BrokerBootstrap.class));
    }

    @Bean
    public BrokerConfig brokerConfig() {
        return BrokerConfig.fromSystemProperties();
    }

    @Bean
    public Authenticator authenticator(BrokerConfig config) {
        return new JwtAuthenticator(config.getJwtSecret());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public BrokerBootstrap brokerBootstrap(Authenticator authenticator, BrokerConfig config) {
        return BrokerBootstrap.builder()
                .authenticator(authenticator)
                .config(config)
                .build();
    }

    @Bean
    public Broker broker(BrokerBootstrap bootstrap) {
        return bootstrap.broker();
    }

    @Bean
    public OrderTrackingService orderTrackingService(Broker broker) {
        return new OrderTrackingService(broker);
    }

    @Bean
    public OfflineDeliveryChannel offlineDeliveryChannel() {
        return new LoggingOfflineDeliveryChannel();
    }

    @Bean
    public NotificationService notificationService(Broker broker, OfflineDeliveryChannel offline) {
        return new NotificationService(broker, offline);
    }

}
