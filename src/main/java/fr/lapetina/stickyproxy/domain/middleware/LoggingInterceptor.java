package fr.lapetina.stickyproxy.domain.middleware;

import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Access log: counts every forwarded request and logs its method and target.
 */
public final class LoggingInterceptor implements UpstreamInterceptor {

    private static final Logger log = LoggerFactory.getLogger(LoggingInterceptor.class);

    private final ConfigState configState;

    public LoggingInterceptor(ConfigState configState) {
        this.configState = Objects.requireNonNull(configState, "ConfigState is required");
    }

    @Override
    public void intercept(String address, ProxyExchange exchange, Chain next) throws IOException {
        configState.incrementGlobalCounter();
        log.info("Forwarding request: method={}, uri={}, upstream={}",
                exchange.request().method(), exchange.request().uri(), address);
        next.proceed(exchange);
    }
}
