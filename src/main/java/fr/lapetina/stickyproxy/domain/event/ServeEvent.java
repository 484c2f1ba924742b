package fr.lapetina.stickyproxy.domain.event;

/**
 * Ring buffer slot describing one completed serve.
 *
 * Mutable and reused by the Disruptor; only touched by the publishing thread
 * between claim and publish, and by handlers afterwards.
 */
public final class ServeEvent {

    private String address;
    private String method;
    private int status;
    private long durationNanos;
    private boolean webSocket;
    private boolean failed;

    public void clear() {
        this.address = null;
        this.method = null;
        this.status = 0;
        this.durationNanos = 0;
        this.webSocket = false;
        this.failed = false;
    }

    public void initialize(String address, String method, int status, long durationNanos,
                           boolean webSocket, boolean failed) {
        this.address = address;
        this.method = method;
        this.status = status;
        this.durationNanos = durationNanos;
        this.webSocket = webSocket;
        this.failed = failed;
    }

    /**
     * Coarse outcome used as a metric tag: {@code error}, {@code ws},
     * or the status class such as {@code 2xx}.
     */
    public String outcome() {
        if (failed) {
            return "error";
        }
        if (webSocket && status == 101) {
            return "ws";
        }
        if (status < 100 || status > 599) {
            return "unknown";
        }
        return (status / 100) + "xx";
    }

    public String getAddress() {
        return address;
    }

    public String getMethod() {
        return method;
    }

    public int getStatus() {
        return status;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    public boolean isWebSocket() {
        return webSocket;
    }

    public boolean isFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "ServeEvent{" +
                "address='" + address + '\'' +
                ", method='" + method + '\'' +
                ", status=" + status +
                ", durationNanos=" + durationNanos +
                ", webSocket=" + webSocket +
                ", failed=" + failed +
                '}';
    }
}
