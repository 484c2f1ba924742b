package fr.lapetina.stickyproxy.domain.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StickyTableTest {

    private final AtomicLong clock = new AtomicLong();

    @Test
    @DisplayName("should return nothing for an unknown session")
    void shouldReturnEmptyForUnknownSession() {
        assertThat(StickyTable.unbounded().lookup("nope")).isEmpty();
    }

    @Test
    @DisplayName("should resolve a bound session and its token")
    void shouldResolveBinding() {
        StickyTable table = StickyTable.unbounded();

        StickyTable.Association association = table.bind("doc-1", "http://a:8080");

        assertThat(table.lookup("doc-1")).contains(association);
        assertThat(table.addressForToken(association.token())).contains("http://a:8080");
    }

    @Test
    @DisplayName("should drop the previous token when a session is re-bound")
    void shouldReplaceToken() {
        StickyTable table = StickyTable.unbounded();
        StickyTable.Association first = table.bind("doc-1", "http://a:8080");

        StickyTable.Association second = table.bind("doc-1", "http://b:8080");

        assertThat(second.token()).isNotEqualTo(first.token());
        assertThat(table.addressForToken(first.token())).isEmpty();
        assertThat(table.lookup("doc-1").orElseThrow().address()).isEqualTo("http://b:8080");
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should evict the least recently used session when full")
    void shouldEvictLeastRecentlyUsed() {
        StickyTable table = new StickyTable(2, Duration.ZERO, clock::get);
        StickyTable.Association one = table.bind("one", "http://a:8080");
        table.bind("two", "http://b:8080");
        table.lookup("one");

        table.bind("three", "http://c:8080");

        assertThat(table.lookup("two")).isEmpty();
        assertThat(table.lookup("one")).isPresent();
        assertThat(table.addressForToken(one.token())).contains("http://a:8080");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getEvictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("should forget sessions idle for longer than the TTL")
    void shouldExpireIdleSessions() {
        StickyTable table = new StickyTable(10, Duration.ofSeconds(30), clock::get);
        StickyTable.Association association = table.bind("doc-1", "http://a:8080");

        clock.addAndGet(Duration.ofSeconds(20).toNanos());
        assertThat(table.lookup("doc-1")).isPresent();

        clock.addAndGet(Duration.ofSeconds(29).toNanos());
        assertThat(table.lookup("doc-1")).isPresent();

        clock.addAndGet(Duration.ofSeconds(30).toNanos());
        assertThat(table.lookup("doc-1")).isEmpty();
        assertThat(table.addressForToken(association.token())).isEmpty();
        assertThat(table.getEvictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("should peek at a session without extending its idle time")
    void shouldPeekWithoutRefreshingIdleTime() {
        StickyTable table = new StickyTable(10, Duration.ofNanos(100), clock::get);
        StickyTable.Association association = table.bind("doc-1", "http://a:8080");

        clock.set(90);
        assertThat(table.peek("doc-1")).contains(association);

        clock.set(150);
        assertThat(table.peek("doc-1")).isEmpty();
        assertThat(table.lookup("doc-1")).isEmpty();
    }

    @Test
    @DisplayName("should peek at a session without changing eviction order")
    void shouldPeekWithoutChangingEvictionOrder() {
        StickyTable table = new StickyTable(2, Duration.ZERO, clock::get);
        table.bind("one", "http://a:8080");
        table.bind("two", "http://b:8080");

        assertThat(table.peek("one")).isPresent();
        table.bind("three", "http://c:8080");

        assertThat(table.peek("one")).isEmpty();
        assertThat(table.peek("two")).isPresent();
        assertThat(table.peek("three")).isPresent();
    }

    @Test
    @DisplayName("should purge expired sessions when binding")
    void shouldPurgeOnBind() {
        StickyTable table = new StickyTable(10, Duration.ofSeconds(1), clock::get);
        table.bind("old-1", "http://a:8080");
        table.bind("old-2", "http://a:8080");

        clock.addAndGet(Duration.ofSeconds(2).toNanos());
        table.bind("fresh", "http://b:8080");

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.getEvictions()).isEqualTo(2);
    }

    @Test
    @DisplayName("should reject invalid bounds")
    void shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new StickyTable(0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StickyTable(1, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
