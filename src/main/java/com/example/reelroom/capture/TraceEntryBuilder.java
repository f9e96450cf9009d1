package com.example.reelroom.capture;

import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.model.TransportKind;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns the request and response sides of one outbound call into a {@link TraceEntry}.
 */
public class TraceEntryBuilder {

    static final String TRUNCATED_SUFFIX = "\n...[truncated]";

    private final int maxBodyChars;
    private final Clock clock;

    public TraceEntryBuilder(int maxBodyChars, Clock clock) {
        this.maxBodyChars = maxBodyChars;
        this.clock = clock;
    }

    public int getMaxBodyChars() { return maxBodyChars; }

    public PendingCall begin(TransportKind kind, String method, URI uri, HttpHeaders headers, byte[] body) {
        HttpHeaders copy = new HttpHeaders();
        if (headers != null) copy.putAll(headers);
        return new PendingCall(UUID.randomUUID().toString(), kind,
                method == null ? "GET" : method.toUpperCase(Locale.ROOT),
                uri, copy, body == null ? new byte[0] : body, clock.millis());
    }

    public TraceEntry complete(PendingCall call, int status, String statusText, HttpHeaders headers, byte[] body) {
        TraceEntry entry = base(call);
        TraceEntry.Response res = entry.getResponse();
        res.setStatus(status);
        res.setStatusText(statusText == null ? "" : statusText);

        HttpHeaders h = headers == null ? new HttpHeaders() : headers;
        res.setHeaders(toPairs(h));

        TraceEntry.Content content = res.getContent();
        content.setSize(h.getContentLength() >= 0 ? h.getContentLength() : 0);
        content.setMimeType(h.getFirst(HttpHeaders.CONTENT_TYPE) == null ? "" : h.getFirst(HttpHeaders.CONTENT_TYPE));
        content.setText(truncate(decode(body, h)));
        return entry;
    }

    /**
     * Entry for a call that never got an HTTP answer.
     */
    public TraceEntry fail(PendingCall call, Exception error) {
        TraceEntry entry = base(call);
        TraceEntry.Response res = entry.getResponse();
        res.setStatus(0);
        String msg = error == null ? null : error.getMessage();
        res.setStatusText(msg == null || msg.isBlank() ? "Network Error" : msg);
        return entry;
    }

    private TraceEntry base(PendingCall call) {
        TraceEntry entry = new TraceEntry();
        entry.setKind(call.getKind());
        entry.setClientRequestId(call.getCorrelationId());
        entry.setStartedDateTime(Instant.ofEpochMilli(call.getStartedAtEpochMs()).toString());
        entry.setTime(Math.max(0, clock.millis() - call.getStartedAtEpochMs()));

        TraceEntry.Request req = entry.getRequest();
        req.setMethod(call.getMethod());
        req.setUrl(call.getUri() == null ? "" : call.getUri().toString());
        req.setHeaders(toPairs(call.getRequestHeaders()));
        req.setQueryString(parseQueryString(call.getUri()));

        byte[] body = call.getRequestBody();
        if (body.length > 0) {
            String mime = call.getRequestHeaders().getFirst(HttpHeaders.CONTENT_TYPE);
            req.setPostData(new TraceEntry.PostData(mime == null ? "text/plain" : mime,
                    truncate(decode(body, call.getRequestHeaders()))));
        }
        return entry;
    }

    String truncate(String s) {
        if (s == null) return "";
        if (s.length() <= maxBodyChars) return s;
        return s.substring(0, maxBodyChars) + TRUNCATED_SUFFIX;
    }

    static List<TraceEntry.NameValue> toPairs(HttpHeaders headers) {
        List<TraceEntry.NameValue> out = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            for (String v : e.getValue()) {
                out.add(new TraceEntry.NameValue(e.getKey(), v));
            }
        }
        return out;
    }

    /**
     * Splits the raw query on '&' and the first '='. Values that fail to decode are kept raw.
     */
    static List<TraceEntry.NameValue> parseQueryString(URI uri) {
        List<TraceEntry.NameValue> out = new ArrayList<>();
        if (uri == null) return out;
        String query = uri.getRawQuery();
        if (query == null || query.isEmpty()) return out;

        for (String part : query.split("&")) {
            if (part.isEmpty()) continue;
            int idx = part.indexOf('=');
            String name = idx >= 0 ? part.substring(0, idx) : part;
            String value = idx >= 0 ? part.substring(idx + 1) : "";
            out.add(new TraceEntry.NameValue(decodeComponent(name), decodeComponent(value)));
        }
        return out;
    }

    private static String decodeComponent(String raw) {
        try {
            return UriUtils.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    private static String decode(byte[] body, HttpHeaders headers) {
        if (body == null || body.length == 0) return "";
        return new String(body, charsetOf(headers));
    }

    private static Charset charsetOf(HttpHeaders headers) {
        String raw = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        if (raw == null || raw.isBlank()) return StandardCharsets.UTF_8;
        try {
            Charset cs = MediaType.parseMediaType(raw).getCharset();
            return cs == null ? StandardCharsets.UTF_8 : cs;
        } catch (IllegalArgumentException e) {
            // bad media type or unknown charset; the header itself is still recorded verbatim
            return StandardCharsets.UTF_8;
        }
    }
}
