package org.github.zzf.realtime.server.metric;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class MicroMeterMetrics implements AutoCloseable {

    final String appName;
    /* 127.0.0.1:9090, null disables the scrape endpoint */
    @Nullable
    final String prometheusExportAddress;

    private HttpServer server;

    @Builder
    public MicroMeterMetrics(String appName, @Nullable String prometheusExportAddress) {
        this.appName = appName;
        this.prometheusExportAddress = prometheusExportAddress;
    }

    public MicroMeterMetrics init() {
        log.info("MicroMeterMetrics appName: {}", appName);
        Metrics.globalRegistry.config().commonTags("application", appName);
        if (prometheusExportAddress != null) {
            log.info("MicroMeterMetrics prometheusExport: {}", prometheusExportAddress);
            initPrometheusExporter(prometheusExportAddress);
        }
        initMetrics();
        return this;
    }

    private void initPrometheusExporter(String exportAddress) {
        String[] hostAndPort = exportAddress.split(":");
        InetSocketAddress address = new InetSocketAddress(hostAndPort[0], Integer.parseInt(hostAndPort[1]));
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.addRegistry(registry);
        try {
            server = HttpServer.create(address, 0);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        server.createContext("/metrics", httpExchange -> {
            byte[] response = registry.scrape().getBytes(StandardCharsets.UTF_8);
            httpExchange.sendResponseHeaders(200, response.length);
            try (OutputStream os = httpExchange.getResponseBody()) {
                os.write(response);
            }
        });
        Thread thread = new Thread(server::start, "prometheus-http-server");
        thread.setDaemon(true);
        thread.start();
        log.info("prometheus exporter start success, bound: {}", server.getAddress());
    }

    private static void initMetrics() {
        MeterRegistry registry = Metrics.globalRegistry;
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            log.info("prometheus exporter stopped");
        }
    }

}
