package fr.lapetina.stickyproxy.domain.dispatch;

import fr.lapetina.stickyproxy.domain.upstream.ResponseSink;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Passes every call through and copies at most the sampler's limit of body
 * bytes aside. Used by one exchange at a time.
 */
final class SamplingResponseSink implements ResponseSink {

    private final ResponseSink delegate;
    private final ResponseSampler sampler;
    private final byte[] buffer;
    private int length;
    private boolean truncated;
    private int status;

    SamplingResponseSink(ResponseSink delegate, ResponseSampler sampler) {
        this.delegate = delegate;
        this.sampler = sampler;
        this.buffer = new byte[sampler.getMaxBytes()];
    }

    @Override
    public void sendHead(int status, Map<String, List<String>> headers) throws IOException {
        this.status = status;
        delegate.sendHead(status, headers);
    }

    @Override
    public void write(byte[] chunk, int offset, int len) throws IOException {
        int room = buffer.length - length;
        int copied = Math.min(room, len);
        if (copied > 0) {
            System.arraycopy(chunk, offset, buffer, length, copied);
            length += copied;
        }
        if (copied < len) {
            truncated = true;
        }
        delegate.write(chunk, offset, len);
    }

    @Override
    public void complete() throws IOException {
        delegate.complete();
        sampler.publish(status, buffer, length, truncated);
    }

    @Override
    public boolean isHeadSent() {
        return delegate.isHeadSent();
    }
}
