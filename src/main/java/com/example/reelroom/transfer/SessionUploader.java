package com.example.reelroom.transfer;

import com.example.reelroom.archive.PackagedArchive;
import com.example.reelroom.archive.ProgressListener;
import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.UploadResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

/**
 * Posts a packaged archive to the remote session sink as multipart/form-data.
 */
@Component
public class SessionUploader {

    private static final Logger log = LoggerFactory.getLogger(SessionUploader.class);

    static final int SLICE = 64 * 1024;
    static final MediaType ZIP = MediaType.parseMediaType("application/zip");

    private final RestTemplate restTemplate;
    private final ReelroomProperties.Upload cfg;
    private final ObjectMapper om = new ObjectMapper();

    public SessionUploader(RestTemplate transferRestTemplate, ReelroomProperties props) {
        this.restTemplate = transferRestTemplate;
        this.cfg = props.getUpload();
    }

    public UploadResponse upload(PackagedArchive archive, ProgressListener progress, CancellationToken token) {
        return upload(archive.getBytes(), archive.getFileName(), progress, token);
    }

    public UploadResponse upload(byte[] data, String fileName, ProgressListener progress, CancellationToken token) {
        if (data.length > cfg.getMaxBytes()) {
            throw new PayloadTooLargeException(data.length, cfg.getMaxBytes());
        }
        String endpoint = cfg.getEndpoint();
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("upload endpoint is not configured (reelroom.upload.endpoint)");
        }
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        token.throwIfCancelled();

        InMemoryMessage body = encode(data, fileName);
        log.info("uploading {} ({} bytes, {} bytes on the wire) to {}", fileName, data.length, body.size(), endpoint);

        try {
            UploadResponse res = restTemplate.execute(URI.create(endpoint), HttpMethod.POST,
                    request -> send(request, body, listener, token),
                    this::readResponse);
            listener.onProgress(100);
            return res;
        } catch (HttpStatusCodeException e) {
            int status = e.getRawStatusCode();
            String serverError = errorField(e.getResponseBodyAsString());
            throw new UploadException(status, serverError != null ? serverError : "Upload failed with status " + status, e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new UploadException(0, "Upload timeout", e);
            }
            throw new UploadException(0, "Network error during upload", e);
        } catch (RestClientException e) {
            throw new UploadException(0, "Upload failed: " + e.getMessage(), e);
        }
    }

    private InMemoryMessage encode(byte[] data, String fileName) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();

        HttpHeaders fileHeaders = new HttpHeaders();
        fileHeaders.setContentType(ZIP);
        parts.add("file", new HttpEntity<>(new NamedResource(data, fileName), fileHeaders));
        addIfPresent(parts, "platform", cfg.getPlatform());
        addIfPresent(parts, "device_id", cfg.getDeviceId());
        addIfPresent(parts, "jira_id", cfg.getJiraId());

        InMemoryMessage msg = new InMemoryMessage();
        try {
            new FormHttpMessageConverter().write(parts, MediaType.MULTIPART_FORM_DATA, msg);
        } catch (IOException e) {
            throw new UploadException(0, "Failed to encode upload body", e);
        }
        return msg;
    }

    private void send(ClientHttpRequest request, InMemoryMessage body, ProgressListener listener, CancellationToken token) throws IOException {
        HttpHeaders h = request.getHeaders();
        h.setContentType(body.getHeaders().getContentType());
        h.setContentLength(body.size());
        h.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
        for (Map.Entry<String, String> e : cfg.getHeaders().entrySet()) {
            h.set(e.getKey(), e.getValue());
        }

        byte[] bytes = body.toByteArray();
        OutputStream out = request.getBody();
        listener.onProgress(0);
        for (int off = 0; off < bytes.length; off += SLICE) {
            token.throwIfCancelled();
            int len = Math.min(SLICE, bytes.length - off);
            out.write(bytes, off, len);
            listener.onProgress((off + len) * 100.0 / bytes.length);
        }
        out.flush();
    }

    private UploadResponse readResponse(ClientHttpResponse response) throws IOException {
        int status = response.getRawStatusCode();
        String text = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        // the error handler only rejects 4xx/5xx, and redirects are not followed for POST
        if (status < 200 || status >= 300) {
            String serverError = errorField(text);
            throw new UploadException(status, serverError != null ? serverError : "Upload failed with status " + status);
        }
        if (text.isBlank()) return new UploadResponse(true, null, null);

        JsonNode node;
        try {
            node = om.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("upload sink answered {} with a non-JSON body", status);
            return new UploadResponse(true, null, null);
        }
        if (!node.isObject()) return new UploadResponse(true, null, null);

        UploadResponse res = om.treeToValue(node, UploadResponse.class);
        if (!node.has("success")) res.setSuccess(true);
        if (!res.isSuccess()) {
            throw new UploadException(status, res.getError() != null ? res.getError() : "Upload rejected by server");
        }
        return res;
    }

    private String errorField(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            JsonNode err = om.readTree(body).path("error");
            return err.isTextual() && !err.asText().isBlank() ? err.asText() : null;
        } catch (JsonProcessingException e) {
            log.debug("error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static void addIfPresent(MultiValueMap<String, Object> parts, String name, String value) {
        if (value != null && !value.isBlank()) parts.add(name, value);
    }

    private static final class NamedResource extends ByteArrayResource {
        private final String fileName;

        NamedResource(byte[] data, String fileName) {
            super(data);
            this.fileName = fileName;
        }

        @Override
        public String getFilename() { return fileName; }
    }

    private static final class InMemoryMessage implements HttpOutputMessage {
        private final HttpHeaders headers = new HttpHeaders();
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        @Override
        public HttpHeaders getHeaders() { return headers; }

        @Override
        public OutputStream getBody() { return out; }

        int size() { return out.size(); }

        byte[] toByteArray() { return out.toByteArray(); }
    }
}
