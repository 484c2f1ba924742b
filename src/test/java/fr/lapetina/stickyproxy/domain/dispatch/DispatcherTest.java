package fr.lapetina.stickyproxy.domain.dispatch;

import fr.lapetina.stickyproxy.domain.model.ConfigState;
import fr.lapetina.stickyproxy.domain.upstream.Upstream;
import fr.lapetina.stickyproxy.support.StubExchange;
import fr.lapetina.stickyproxy.support.StubUpstream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatcherTest {

    private StubUpstream a;
    private StubUpstream b;
    private StubUpstream c;

    @BeforeEach
    void setUp() {
        a = StubUpstream.named("a");
        b = StubUpstream.named("b");
        c = StubUpstream.named("c");
    }

    private Dispatcher dispatcher(ConfigState state) {
        return new Dispatcher(List.of(a, b, c), state);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject an empty upstream list")
        void shouldRejectEmptyList() {
            assertThatThrownBy(() -> new Dispatcher(List.of(), ConfigState.defaults()))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject a reset value outside the upstream range")
        void shouldRejectResetValueOutOfRange() {
            assertThatThrownBy(() -> new Dispatcher(List.of(a, b), new ConfigState(2, 2, false)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("httpCursorResetValue");
        }

        @Test
        @DisplayName("should reject duplicate addresses")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> new Dispatcher(List.of(a, StubUpstream.named("a")), ConfigState.defaults()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("should start both cursors at zero")
        void shouldStartAtZero() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            assertThat(dispatcher.httpCursor()).isZero();
            assertThat(dispatcher.wsCursor()).isZero();
            assertThat(dispatcher.getSessionParameter()).isEqualTo(Dispatcher.DEFAULT_SESSION_PARAMETER);
        }
    }

    @Nested
    @DisplayName("HTTP round robin")
    class HttpRoundRobin {

        @Test
        @DisplayName("should rotate through all alive upstreams in order")
        void shouldRotateInOrder() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            List<Upstream> picked = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                picked.add(dispatcher.selectUpstream(false));
            }

            assertThat(picked).containsExactly(a, b, c, a, b);
            assertThat(dispatcher.httpCursor()).isEqualTo(2);
        }

        @Test
        @DisplayName("should distribute evenly over many selections")
        void shouldDistributeEvenly() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());
            Map<Upstream, Integer> counts = new ConcurrentHashMap<>();

            for (int i = 0; i < 300; i++) {
                counts.merge(dispatcher.selectUpstream(false), 1, Integer::sum);
            }

            assertThat(counts).containsEntry(a, 100).containsEntry(b, 100).containsEntry(c, 100);
        }

        @Test
        @DisplayName("should skip dead upstreams and advance past the one found")
        void shouldSkipDeadUpstreams() {
            b.alive(false);
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            assertThat(dispatcher.selectUpstream(false)).isSameAs(a);
            assertThat(dispatcher.selectUpstream(false)).isSameAs(c);
            assertThat(dispatcher.httpCursor()).isZero();
            assertThat(dispatcher.selectUpstream(false)).isSameAs(a);
        }

        @Test
        @DisplayName("should never return a dead upstream while one is alive")
        void shouldNeverReturnDeadUpstream() {
            a.alive(false);
            c.alive(false);
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            for (int i = 0; i < 20; i++) {
                assertThat(dispatcher.selectUpstream(i % 2 == 0)).isSameAs(b);
            }
        }

        @Test
        @DisplayName("should fall back to the first upstream and park the cursor when all are dead")
        void shouldFallBackWhenAllDead() {
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), new ConfigState(2, 1, false));
            dispatcher.selectUpstream(false);
            dispatcher.selectUpstream(false);
            a.alive(false);
            b.alive(false);
            c.alive(false);

            assertThat(dispatcher.selectUpstream(false)).isSameAs(a);
            assertThat(dispatcher.httpCursor()).isEqualTo(1);
            assertThat(dispatcher.selectUpstream(false)).isSameAs(a);
            assertThat(dispatcher.httpCursor()).isEqualTo(1);
        }

        @Test
        @DisplayName("should resume from the parked cursor once upstreams recover")
        void shouldResumeFromParkedCursor() {
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), new ConfigState(2, 1, false));
            a.alive(false);
            b.alive(false);
            c.alive(false);
            dispatcher.selectUpstream(false);

            a.alive(true);
            b.alive(true);
            c.alive(true);

            assertThat(dispatcher.selectUpstream(false)).isSameAs(b);
        }
    }

    @Nested
    @DisplayName("WebSocket round robin")
    class WebSocketRoundRobin {

        @Test
        @DisplayName("should advance the WebSocket cursor by the configured step")
        void shouldAdvanceByStep() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            assertThat(dispatcher.selectUpstream(true)).isSameAs(a);
            assertThat(dispatcher.wsCursor()).isEqualTo(2);
            assertThat(dispatcher.selectUpstream(true)).isSameAs(c);
            assertThat(dispatcher.wsCursor()).isEqualTo(1);
            assertThat(dispatcher.selectUpstream(true)).isSameAs(b);
        }

        @Test
        @DisplayName("should keep the two cursors independent")
        void shouldKeepCursorsIndependent() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            dispatcher.selectUpstream(true);
            dispatcher.selectUpstream(true);

            assertThat(dispatcher.httpCursor()).isZero();
            assertThat(dispatcher.selectUpstream(false)).isSameAs(a);
        }

        @Test
        @DisplayName("should leave the WebSocket cursor alone on total outage")
        void shouldNotParkWebSocketCursor() {
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), new ConfigState(2, 1, false));
            dispatcher.selectUpstream(true);
            a.alive(false);
            b.alive(false);
            c.alive(false);

            assertThat(dispatcher.selectUpstream(true)).isSameAs(a);
            assertThat(dispatcher.wsCursor()).isEqualTo(2);
            assertThat(dispatcher.httpCursor()).isZero();
        }
    }

    @Nested
    @DisplayName("Sticky routing")
    class StickyRouting {

        @Test
        @DisplayName("should keep returning the pinned upstream while alive")
        void shouldKeepPinnedUpstream() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            Upstream first = dispatcher.routeForSession("doc-42", false);
            dispatcher.selectUpstream(false);
            dispatcher.selectUpstream(false);

            for (int i = 0; i < 10; i++) {
                assertThat(dispatcher.routeForSession("doc-42", i % 2 == 0)).isSameAs(first);
            }
            assertThat(dispatcher.getStickyTable().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should re-route and re-pin when the pinned upstream dies")
        void shouldFailOver() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());
            Upstream first = dispatcher.routeForSession("doc-42", false);
            assertThat(first).isSameAs(a);
            StickyTable.Association before = dispatcher.getStickyTable().lookup("doc-42").orElseThrow();

            a.alive(false);
            Upstream second = dispatcher.routeForSession("doc-42", false);

            assertThat(second).isSameAs(b);
            StickyTable.Association after = dispatcher.getStickyTable().lookup("doc-42").orElseThrow();
            assertThat(after.address()).isEqualTo(b.getAddress());
            assertThat(after.token()).isNotEqualTo(before.token());

            a.alive(true);
            assertThat(dispatcher.routeForSession("doc-42", false)).isSameAs(b);
        }

        @Test
        @DisplayName("should treat session ids with surrounding whitespace as the same session")
        void shouldTrimSessionIds() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            Upstream first = dispatcher.routeForSession(" doc-7 ", false);

            assertThat(dispatcher.routeForSession("doc-7", false)).isSameAs(first);
        }

        @Test
        @DisplayName("should fall back to plain round robin for a blank session id")
        void shouldIgnoreBlankSession() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            assertThat(dispatcher.routeForSession("  ", false)).isSameAs(a);
            assertThat(dispatcher.routeForSession(null, false)).isSameAs(b);
            assertThat(dispatcher.getStickyTable().size()).isZero();
        }

        @Test
        @DisplayName("should select a new session through the WebSocket cursor for upgrades")
        void shouldUseWebSocketCursorForNewSessions() {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            dispatcher.routeForSession("ws-1", true);

            assertThat(dispatcher.wsCursor()).isEqualTo(2);
            assertThat(dispatcher.httpCursor()).isZero();
        }
    }

    @Nested
    @DisplayName("handleRequest")
    class HandleRequest {

        @Test
        @DisplayName("should route requests carrying the session parameter stickily")
        void shouldRouteStickily() throws Exception {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            StubExchange first = StubExchange.get("/view?document_id=42");
            dispatcher.handleRequest(first);
            StubExchange plain = StubExchange.get("/view");
            dispatcher.handleRequest(plain);
            StubExchange second = StubExchange.get("/edit?document_id=42");
            dispatcher.handleRequest(second);

            assertThat(first.recorded().bodyText()).isEqualTo(a.getAddress());
            assertThat(plain.recorded().bodyText()).isEqualTo(a.getAddress());
            assertThat(second.recorded().bodyText()).isEqualTo(a.getAddress());
        }

        @Test
        @DisplayName("should pin plain HTTP sessions from the WebSocket cursor")
        void shouldPinHttpSessionsFromWebSocketCursor() throws Exception {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            dispatcher.handleRequest(StubExchange.get("/view?document_id=42"));

            assertThat(dispatcher.wsCursor()).isEqualTo(2);
            assertThat(dispatcher.httpCursor()).isZero();

            StubExchange next = StubExchange.get("/view?document_id=43");
            dispatcher.handleRequest(next);

            assertThat(next.recorded().bodyText()).isEqualTo(c.getAddress());
            assertThat(dispatcher.wsCursor()).isEqualTo(1);
            assertThat(dispatcher.httpCursor()).isZero();
        }

        @Test
        @DisplayName("should honour a custom session parameter name")
        void shouldHonourCustomParameter() throws Exception {
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), ConfigState.defaults(),
                    StickyTable.unbounded(), ResponseSampler.disabled(), "doc");

            dispatcher.handleRequest(StubExchange.get("/?doc=x"));
            dispatcher.handleRequest(StubExchange.get("/?document_id=x"));

            assertThat(dispatcher.getStickyTable().lookup("x")).isPresent();
            assertThat(dispatcher.getStickyTable().size()).isEqualTo(1);
        }

        @Test
        @DisplayName("should send WebSocket upgrades without a session through the HTTP cursor")
        void shouldUseHttpCursorForUnpinnedUpgrades() throws Exception {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());

            dispatcher.handleRequest(StubExchange.webSocket("/socket"));

            assertThat(dispatcher.httpCursor()).isEqualTo(1);
            assertThat(dispatcher.wsCursor()).isZero();
        }

        @Test
        @DisplayName("should sample the response when sampling is enabled")
        void shouldSampleResponse() throws Exception {
            ResponseSampler sampler = new ResponseSampler(8);
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), ConfigState.defaults(),
                    StickyTable.unbounded(), sampler, Dispatcher.DEFAULT_SESSION_PARAMETER);

            StubExchange exchange = StubExchange.get("/");
            dispatcher.handleRequest(exchange);

            assertThat(exchange.recorded().bodyText()).isEqualTo(a.getAddress());
            ResponseSampler.Sample sample = sampler.lastSample().orElseThrow();
            assertThat(sample.status()).isEqualTo(200);
            assertThat(sample.bodyText()).isEqualTo(a.getAddress().substring(0, 8));
            assertThat(sample.truncated()).isTrue();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("should hand out a fair rotation under concurrent selection")
        void shouldStayFairUnderContention() throws Exception {
            Dispatcher dispatcher = dispatcher(ConfigState.defaults());
            Map<Upstream, AtomicInteger> counts = new ConcurrentHashMap<>();
            int threads = 8;
            int perThread = 3_000;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    futures.add(pool.submit(() -> {
                        go.await();
                        for (int i = 0; i < perThread; i++) {
                            counts.computeIfAbsent(dispatcher.selectUpstream(false), k -> new AtomicInteger())
                                    .incrementAndGet();
                        }
                        return null;
                    }));
                }
                go.countDown();
                for (Future<?> f : futures) {
                    f.get();
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(counts.get(a)).hasValue(8_000);
            assertThat(counts.get(b)).hasValue(8_000);
            assertThat(counts.get(c)).hasValue(8_000);
            assertThat(dispatcher.httpCursor()).isZero();
        }

        @Test
        @DisplayName("should converge on a single association per session")
        void shouldConvergeOnOneAssociation() throws Exception {
            Dispatcher dispatcher = new Dispatcher(List.of(a, b, c), ConfigState.defaults(),
                    new StickyTable(1_000, Duration.ZERO), ResponseSampler.disabled(),
                    Dispatcher.DEFAULT_SESSION_PARAMETER);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Upstream>> futures = new ArrayList<>();
                for (int i = 0; i < 64; i++) {
                    futures.add(pool.submit(() -> dispatcher.routeForSession("shared", false)));
                }
                for (Future<Upstream> f : futures) {
                    f.get();
                }
            } finally {
                pool.shutdownNow();
            }

            String pinned = dispatcher.getStickyTable().lookup("shared").orElseThrow().address();
            assertThat(dispatcher.getStickyTable().size()).isEqualTo(1);
            assertThat(dispatcher.routeForSession("shared", false).getAddress()).isEqualTo(pinned);
        }
    }
}
