package com.example.reelroom.transfer;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.mock.http.client.MockClientHttpResponse;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory file server for downloader tests. Answers HEAD with the size and GET with the whole
 * file or a 206 slice, and can be told to fail or truncate specific ranges.
 */
class RangeServingRequestFactory implements ClientHttpRequestFactory {

    private final byte[] file;
    private final Map<String, AtomicInteger> failuresLeft = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> truncationsLeft = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    private volatile boolean reportLength = true;
    private volatile boolean honorRanges = true;
    private volatile long latencyMs = 0;
    private volatile Runnable onRequest = () -> {};

    RangeServingRequestFactory(byte[] file) {
        this.file = file;
    }

    static byte[] fileOf(int size) {
        byte[] data = new byte[size];
        for (int i = 0; i < size; i++) data[i] = (byte) (i * 31 + 7);
        return data;
    }

    RangeServingRequestFactory failTimes(String range, int times) {
        failuresLeft.put(range, new AtomicInteger(times));
        return this;
    }

    RangeServingRequestFactory truncateOnce(String range) {
        truncationsLeft.put(range, new AtomicInteger(1));
        return this;
    }

    RangeServingRequestFactory withoutContentLength() {
        reportLength = false;
        return this;
    }

    RangeServingRequestFactory ignoringRanges() {
        honorRanges = false;
        return this;
    }

    RangeServingRequestFactory withLatency(long ms) {
        latencyMs = ms;
        return this;
    }

    RangeServingRequestFactory onRequest(Runnable hook) {
        onRequest = hook;
        return this;
    }

    int attemptsFor(String range) {
        AtomicInteger n = attempts.get(range);
        return n == null ? 0 : n.get();
    }

    List<String> requests() { return requests; }

    int maxInFlight() { return maxInFlight.get(); }

    @Override
    public ClientHttpRequest createRequest(URI uri, HttpMethod httpMethod) {
        return new MockClientHttpRequest(httpMethod, uri) {
            @Override
            protected ClientHttpResponse executeInternal() {
                return serve(httpMethod, getHeaders());
            }
        };
    }

    private ClientHttpResponse serve(HttpMethod method, HttpHeaders requestHeaders) {
        String range = requestHeaders.getFirst(HttpHeaders.RANGE);
        requests.add(method + " " + (range == null ? "-" : range));
        onRequest.run();

        if (method == HttpMethod.HEAD) {
            TrackedResponse head = new TrackedResponse(new byte[0], HttpStatus.OK);
            if (reportLength) head.getHeaders().setContentLength(file.length);
            return head;
        }

        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        pause();

        if (range == null || !honorRanges) {
            if (range != null) attempts.computeIfAbsent(range, k -> new AtomicInteger()).incrementAndGet();
            return counted(file, HttpStatus.OK);
        }

        attempts.computeIfAbsent(range, k -> new AtomicInteger()).incrementAndGet();
        if (consume(failuresLeft, range)) {
            return counted(new byte[0], HttpStatus.SERVICE_UNAVAILABLE);
        }

        String[] bounds = range.substring("bytes=".length()).split("-");
        int start = Integer.parseInt(bounds[0]);
        int end = Integer.parseInt(bounds[1]);
        byte[] slice = Arrays.copyOfRange(file, start, end + 1);
        if (consume(truncationsLeft, range)) {
            slice = Arrays.copyOf(slice, slice.length - 1);
        }
        TrackedResponse res = counted(slice, HttpStatus.PARTIAL_CONTENT);
        res.getHeaders().set(HttpHeaders.CONTENT_RANGE, "bytes " + start + "-" + end + "/" + file.length);
        return res;
    }

    private TrackedResponse counted(byte[] body, HttpStatus status) {
        TrackedResponse res = new TrackedResponse(body, status);
        res.tracked = true;
        return res;
    }

    private void pause() {
        if (latencyMs <= 0) return;
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean consume(Map<String, AtomicInteger> budget, String range) {
        AtomicInteger left = budget.get(range);
        return left != null && left.getAndDecrement() > 0;
    }

    private final class TrackedResponse extends MockClientHttpResponse {
        private boolean tracked;
        private boolean closed;

        TrackedResponse(byte[] body, HttpStatus status) {
            super(body, status);
        }

        @Override
        public void close() {
            if (tracked && !closed) inFlight.decrementAndGet();
            closed = true;
            super.close();
        }
    }
}
