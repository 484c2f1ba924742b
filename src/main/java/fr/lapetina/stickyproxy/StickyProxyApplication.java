package fr.lapetina.stickyproxy;

import fr.lapetina.stickyproxy.api.AdminServer;
import fr.lapetina.stickyproxy.api.ProxyServer;
import fr.lapetina.stickyproxy.infrastructure.config.ConfigLoader;
import fr.lapetina.stickyproxy.infrastructure.config.ProxyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the sticky proxy.
 */
public class StickyProxyApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StickyProxyApplication.class);

    private final ProxyFactory factory;
    private final ProxyServer proxyServer;
    private final AdminServer adminServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public StickyProxyApplication(String configPath) throws IOException {
        this(ProxyFactory.create(configPath));
    }

    public StickyProxyApplication(ProxyFactory factory) throws IOException {
        log.info("Starting sticky proxy...");
        this.factory = factory.start();

        ProxyConfig config = factory.getConfig();
        this.proxyServer = new ProxyServer(
                config.getServer().getHost(),
                config.getServer().getPort(),
                config.getServer().getMaxContentLength(),
                config.getServer().getIoThreads(),
                factory.getDispatcher(),
                factory.getTunnel()
        );

        if (config.getAdmin().isEnabled()) {
            this.adminServer = new AdminServer(
                    config.getAdmin().getHost(),
                    config.getAdmin().getPort(),
                    config.getAdmin().getBacklog(),
                    factory.getDispatcher(),
                    factory.getMetricsRegistry(),
                    factory.getTelemetry()
            );
        } else {
            this.adminServer = null;
        }

        log.info("Sticky proxy initialized");
    }

    public void start() throws InterruptedException {
        proxyServer.start();
        if (adminServer != null) {
            adminServer.start();
        }
        log.info("Sticky proxy started: port={}", proxyServer.port());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public ProxyFactory getFactory() {
        return factory;
    }

    public ProxyServer getProxyServer() {
        return proxyServer;
    }

    /**
     * Null when the admin endpoint is disabled.
     */
    public AdminServer getAdminServer() {
        return adminServer;
    }

    @Override
    public void close() {
        log.info("Shutting down sticky proxy...");

        try {
            proxyServer.close();
        } catch (Exception e) {
            log.warn("Error closing proxy server", e);
        }

        if (adminServer != null) {
            try {
                adminServer.close();
            } catch (Exception e) {
                log.warn("Error closing admin server", e);
            }
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Sticky proxy shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : ConfigLoader.DEFAULT_PATH;

        try {
            StickyProxyApplication app = new StickyProxyApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted during startup", e);
            System.exit(1);
        } catch (Exception e) {
            log.error("Failed to start sticky proxy", e);
            System.exit(1);
        }
    }
}
