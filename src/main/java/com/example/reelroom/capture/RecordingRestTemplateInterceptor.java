package com.example.reelroom.capture;

import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.model.TransportKind;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;
import java.net.URI;
import java.util.function.Predicate;

/**
 * Records calls made through the application's {@code RestTemplate}.
 */
public class RecordingRestTemplateInterceptor implements ClientHttpRequestInterceptor {

    private final TraceEntryBuilder builder;
    private final CaptureListener sink;
    private final Predicate<URI> ignored;

    public RecordingRestTemplateInterceptor(TraceEntryBuilder builder, CaptureListener sink, Predicate<URI> ignored) {
        this.builder = builder;
        this.sink = sink;
        this.ignored = ignored;
    }

    @Override
    public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
        if (ignored.test(request.getURI())) {
            return execution.execute(request, body);
        }

        PendingCall call = builder.begin(TransportKind.FETCH, request.getMethodValue(), request.getURI(),
                request.getHeaders(), body);
        SinkInvoker.started(sink, call);

        // a read timeout can surface while reading the status or body, not only on execute
        CapturedClientHttpResponse buffered;
        try {
            buffered = CapturedClientHttpResponse.buffer(execution.execute(request, body));
        } catch (IOException e) {
            SinkInvoker.completed(sink, builder.fail(call, e));
            throw e;
        }
        TraceEntry entry = builder.complete(call, buffered.getRawStatusCode(), buffered.getStatusText(),
                buffered.getHeaders(), buffered.getBodyBytes());
        SinkInvoker.completed(sink, entry);
        return buffered;
    }
}
