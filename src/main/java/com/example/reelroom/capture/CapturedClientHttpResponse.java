package com.example.reelroom.capture;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Response whose body has been read once for recording and is replayed byte-for-byte to the caller.
 */
final class CapturedClientHttpResponse implements ClientHttpResponse {

    private final ClientHttpResponse delegate;
    private final int rawStatus;
    private final String statusText;
    private final byte[] body;

    private CapturedClientHttpResponse(ClientHttpResponse delegate, int rawStatus, String statusText, byte[] body) {
        this.delegate = delegate;
        this.rawStatus = rawStatus;
        this.statusText = statusText;
        this.body = body;
    }

    /**
     * Reads status, status text and body of {@code response}. On failure the response is closed and
     * the exception propagates, so the caller can record the call as a transport failure.
     */
    static CapturedClientHttpResponse buffer(ClientHttpResponse response) throws IOException {
        try {
            int status = response.getRawStatusCode();
            String text = response.getStatusText();
            byte[] bytes;
            try {
                InputStream in = response.getBody();
                bytes = in == null ? new byte[0] : StreamUtils.copyToByteArray(in);
            } catch (IOException e) {
                // HttpURLConnection throws for error statuses that carry no body
                if (status < 400) throw e;
                bytes = new byte[0];
            }
            return new CapturedClientHttpResponse(response, status, text, bytes);
        } catch (IOException e) {
            response.close();
            throw e;
        }
    }

    byte[] getBodyBytes() { return body; }

    @Override
    public HttpStatus getStatusCode() throws IOException {
        return HttpStatus.valueOf(rawStatus);
    }

    @Override
    public int getRawStatusCode() {
        return rawStatus;
    }

    @Override
    public String getStatusText() {
        return statusText;
    }

    @Override
    public HttpHeaders getHeaders() {
        return delegate.getHeaders();
    }

    @Override
    public InputStream getBody() {
        return new ByteArrayInputStream(body);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
