package fr.lapetina.stickyproxy.domain.middleware;

import fr.lapetina.stickyproxy.domain.upstream.ProxyExchange;
import fr.lapetina.stickyproxy.domain.upstream.Upstream;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * An upstream with an ordered list of interceptors applied around its {@code serve}.
 *
 * The first interceptor is the outermost: {@code [Logging, Telemetry]} behaves
 * as Logging(Telemetry(base)). Address and liveness always come from the base.
 */
public final class InterceptedUpstream implements Upstream {

    private final Upstream base;
    private final List<UpstreamInterceptor> interceptors;

    public InterceptedUpstream(Upstream base, List<UpstreamInterceptor> interceptors) {
        this.base = Objects.requireNonNull(base, "Base upstream is required");
        this.interceptors = List.copyOf(interceptors);
    }

    @Override
    public String getAddress() {
        return base.getAddress();
    }

    @Override
    public boolean isAlive() {
        return base.isAlive();
    }

    @Override
    public void serve(ProxyExchange exchange) throws IOException {
        proceed(0, exchange);
    }

    private void proceed(int index, ProxyExchange exchange) throws IOException {
        if (index == interceptors.size()) {
            base.serve(exchange);
            return;
        }
        interceptors.get(index).intercept(base.getAddress(), exchange, next -> proceed(index + 1, next));
    }

    /**
     * The undecorated upstream, for admin views that need backend state.
     */
    public Upstream unwrap() {
        return base;
    }

    @Override
    public String toString() {
        return "InterceptedUpstream{base=" + base + ", interceptors=" + interceptors.size() + '}';
    }
}
