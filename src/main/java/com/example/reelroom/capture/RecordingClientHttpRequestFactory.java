package com.example.reelroom.capture;

import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.model.TransportKind;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.function.Predicate;

/**
 * Decorates the low-level request factory so each request it creates is recorded when executed.
 */
public class RecordingClientHttpRequestFactory implements ClientHttpRequestFactory {

    private final ClientHttpRequestFactory delegate;
    private final TraceEntryBuilder builder;
    private final CaptureListener sink;
    private final Predicate<URI> ignored;

    public RecordingClientHttpRequestFactory(ClientHttpRequestFactory delegate, TraceEntryBuilder builder,
                                             CaptureListener sink, Predicate<URI> ignored) {
        this.delegate = delegate;
        this.builder = builder;
        this.sink = sink;
        this.ignored = ignored;
    }

    public ClientHttpRequestFactory getDelegate() { return delegate; }

    @Override
    public ClientHttpRequest createRequest(URI uri, HttpMethod httpMethod) throws IOException {
        ClientHttpRequest request = delegate.createRequest(uri, httpMethod);
        if (ignored.test(uri)) return request;
        return new RecordingRequest(request);
    }

    private final class RecordingRequest implements ClientHttpRequest {

        private final ClientHttpRequest request;
        private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        // utf-8 needs at most 4 bytes per char
        private final long captureLimit = (long) builder.getMaxBodyChars() * 4 + 4;
        private OutputStream body;

        RecordingRequest(ClientHttpRequest request) {
            this.request = request;
        }

        @Override
        public String getMethodValue() { return request.getMethodValue(); }

        @Override
        public URI getURI() { return request.getURI(); }

        @Override
        public HttpHeaders getHeaders() { return request.getHeaders(); }

        @Override
        public OutputStream getBody() throws IOException {
            if (body == null) body = new TeeOutputStream(request.getBody());
            return body;
        }

        @Override
        public ClientHttpResponse execute() throws IOException {
            // headers are read here, so anything set after creation is included
            PendingCall call = builder.begin(TransportKind.REQUEST_OBJECT, getMethodValue(), getURI(),
                    request.getHeaders(), captured.toByteArray());
            SinkInvoker.started(sink, call);

            // a read timeout can surface while reading the status or body, not only on execute
            CapturedClientHttpResponse buffered;
            try {
                buffered = CapturedClientHttpResponse.buffer(request.execute());
            } catch (IOException e) {
                SinkInvoker.completed(sink, builder.fail(call, e));
                throw e;
            }
            TraceEntry entry = builder.complete(call, buffered.getRawStatusCode(), buffered.getStatusText(),
                    buffered.getHeaders(), buffered.getBodyBytes());
            SinkInvoker.completed(sink, entry);
            return buffered;
        }

        private final class TeeOutputStream extends OutputStream {
            private final OutputStream out;

            TeeOutputStream(OutputStream out) {
                this.out = out;
            }

            @Override
            public void write(int b) throws IOException {
                out.write(b);
                if (captured.size() < captureLimit) captured.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
                long room = captureLimit - captured.size();
                if (room > 0) captured.write(b, off, (int) Math.min(room, len));
            }

            @Override
            public void flush() throws IOException {
                out.flush();
            }

            @Override
            public void close() throws IOException {
                out.close();
            }
        }
    }
}
