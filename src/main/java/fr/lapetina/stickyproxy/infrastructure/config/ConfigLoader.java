package fr.lapetina.stickyproxy.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads and validates the proxy configuration.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from a stream (tests)
 *
 * Configuration is read once at startup. Upstream membership and routing
 * tunables are fixed for the life of the process.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_PATH = "config.yaml";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ProxyConfig.class, loaderOptions));
    }

    public ConfigLoader() {
        this(DEFAULT_PATH);
    }

    /**
     * Loads configuration from file or classpath and validates it.
     *
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public ProxyConfig load() {
        return validate(loadFromPath());
    }

    private ProxyConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ProxyConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public ProxyConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private ProxyConfig parse(InputStream is, String source) {
        try {
            ProxyConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new ProxyConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks every constraint the runtime relies on. Reports all problems at once.
     *
     * @throws ConfigurationException listing each violation
     */
    public static ProxyConfig validate(ProxyConfig config) {
        List<String> errors = new ArrayList<>();

        List<ProxyConfig.UpstreamConfig> upstreams = config.getUpstreams();
        if (upstreams == null || upstreams.isEmpty()) {
            errors.add("at least one upstream is required");
        } else {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < upstreams.size(); i++) {
                ProxyConfig.UpstreamConfig upstream = upstreams.get(i);
                String url = upstream == null ? null : upstream.getUrl();
                String problem = checkUrl(url);
                if (problem != null) {
                    errors.add("upstreams[" + i + "].url " + problem);
                } else if (!seen.add(url.trim())) {
                    errors.add("upstreams[" + i + "].url duplicates " + url);
                }
            }
        }

        int port = config.getServer().getPort();
        if (port < 0 || port > 65535) {
            errors.add("server.port must be in [0, 65535], got " + port);
        }
        if (config.getServer().getMaxContentLength() < 1) {
            errors.add("server.maxContentLength must be positive");
        }
        if (config.getServer().getIoThreads() < 0) {
            errors.add("server.ioThreads must not be negative");
        }
        int adminPort = config.getAdmin().getPort();
        if (adminPort < 0 || adminPort > 65535) {
            errors.add("admin.port must be in [0, 65535], got " + adminPort);
        }

        ProxyConfig.RoutingConfig routing = config.getRouting();
        if (routing.getSessionParameter() == null || routing.getSessionParameter().isBlank()) {
            errors.add("routing.sessionParameter must not be blank");
        }
        if (routing.getWsRoundRobinStep() < 1) {
            errors.add("routing.wsRoundRobinStep must be >= 1, got " + routing.getWsRoundRobinStep());
        }
        int upstreamCount = upstreams == null ? 0 : upstreams.size();
        int reset = routing.getHttpCursorResetValue();
        if (reset < 0 || (upstreamCount > 0 && reset >= upstreamCount)) {
            errors.add("routing.httpCursorResetValue must be in [0, " + upstreamCount + "), got " + reset);
        }

        if (config.getSticky().getMaxEntries() < 1) {
            errors.add("sticky.maxEntries must be positive");
        }
        if (config.getSticky().getIdleTtlMs() < 0) {
            errors.add("sticky.idleTtlMs must not be negative");
        }
        if (config.getHealthCheck().getTtlMs() <= 0) {
            errors.add("healthCheck.ttlMs must be positive");
        }
        if (config.getHealthCheck().getTimeoutMs() <= 0) {
            errors.add("healthCheck.timeoutMs must be positive");
        }
        if (config.getTimeouts().getConnectTimeoutMs() <= 0) {
            errors.add("timeouts.connectTimeoutMs must be positive");
        }
        if (config.getTimeouts().getRequestTimeoutMs() < 0) {
            errors.add("timeouts.requestTimeoutMs must not be negative");
        }
        int ring = config.getTelemetry().getRingBufferSize();
        if (ring < 1 || Integer.bitCount(ring) != 1) {
            errors.add("telemetry.ringBufferSize must be a power of 2, got " + ring);
        }
        if (config.getDiagnostics().getResponseSampleBytes() < 0) {
            errors.add("diagnostics.responseSampleBytes must not be negative");
        }

        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
        return config;
    }

    private static String checkUrl(String url) {
        if (url == null || url.isBlank()) {
            return "is required";
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return "must use http or https: " + url;
            }
            if (uri.getHost() == null) {
                return "must include a host: " + url;
            }
            return null;
        } catch (URISyntaxException e) {
            return "is malformed: " + e.getMessage();
        }
    }

    /**
     * Creates a default configuration. It has no upstreams and so does not validate on its own.
     */
    public static ProxyConfig createDefault() {
        return new ProxyConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
