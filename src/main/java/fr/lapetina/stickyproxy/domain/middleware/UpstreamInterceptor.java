package fr.lapetina.stickyproxy.domain.middleware;

import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;

import java.io.IOException;

/**
 * One step around an upstream's {@code serve}. An interceptor sees the exchange
 * before the rest of the chain and decides when (and whether) to proceed.
 */
@FunctionalInterface
public interface UpstreamInterceptor {

    void intercept(String address, ProxyExchange exchange, Chain next) throws IOException;

    /**
     * Remainder of the chain, ending with the base upstream.
     */
    @FunctionalInterface
    interface Chain {
        void proceed(ProxyExchange exchange) throws IOException;
    }
}
