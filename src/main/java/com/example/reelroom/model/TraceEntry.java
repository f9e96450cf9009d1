package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One captured outbound call, shaped as a HAR 1.2 entry so replay tooling can read it as-is.
 * Status 0 on the response means the call never got an HTTP answer. Members without a field here
 * are kept as extra fields.
 */
@JsonPropertyOrder({"_type", "_clientRequestId", "startedDateTime", "time", "request", "response", "cache", "timings"})
public class TraceEntry extends HarFields {

    @JsonProperty("_type")
    private TransportKind kind;

    @JsonProperty("_clientRequestId")
    private String clientRequestId;

    private String startedDateTime;
    private long time;
    private Request request = new Request();
    private Response response = new Response();
    private Map<String, Object> cache = new LinkedHashMap<>();
    private Timings timings = new Timings();

    public TraceEntry() {}

    public TransportKind getKind() { return kind; }
    public void setKind(TransportKind kind) { this.kind = kind; }

    public String getClientRequestId() { return clientRequestId; }
    public void setClientRequestId(String clientRequestId) { this.clientRequestId = clientRequestId; }

    public String getStartedDateTime() { return startedDateTime; }
    public void setStartedDateTime(String startedDateTime) { this.startedDateTime = startedDateTime; }

    public long getTime() { return time; }
    public void setTime(long time) { this.time = time; }

    public Request getRequest() { return request; }
    public void setRequest(Request request) { this.request = request; }

    public Response getResponse() { return response; }
    public void setResponse(Response response) { this.response = response; }

    public Map<String, Object> getCache() { return cache; }
    public void setCache(Map<String, Object> cache) { this.cache = cache; }

    public Timings getTimings() { return timings; }
    public void setTimings(Timings timings) { this.timings = timings; }

    public static class NameValue extends HarFields {
        private String name;
        private String value;

        public NameValue() {}

        public NameValue(String name, String value) {
            this.name = name;
            this.value = value;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getValue() { return value; }
        public void setValue(String value) { this.value = value; }
    }

    @JsonPropertyOrder({"method", "url", "httpVersion", "cookies", "headers", "queryString", "postData", "headersSize", "bodySize"})
    public static class Request extends HarFields {
        private String method;
        private String url;
        private String httpVersion = "NOT_AVAILABLE";
        private List<Object> cookies = new ArrayList<>();
        private List<NameValue> headers = new ArrayList<>();
        private List<NameValue> queryString = new ArrayList<>();
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private PostData postData;
        private long headersSize = -1;
        private long bodySize = -1;

        public Request() {}

        public String getMethod() { return method; }
        public void setMethod(String method) { this.method = method; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getHttpVersion() { return httpVersion; }
        public void setHttpVersion(String httpVersion) { this.httpVersion = httpVersion; }

        public List<Object> getCookies() { return cookies; }
        public void setCookies(List<Object> cookies) { this.cookies = cookies; }

        public List<NameValue> getHeaders() { return headers; }
        public void setHeaders(List<NameValue> headers) { this.headers = headers; }

        public List<NameValue> getQueryString() { return queryString; }
        public void setQueryString(List<NameValue> queryString) { this.queryString = queryString; }

        public PostData getPostData() { return postData; }
        public void setPostData(PostData postData) { this.postData = postData; }

        public long getHeadersSize() { return headersSize; }
        public void setHeadersSize(long headersSize) { this.headersSize = headersSize; }

        public long getBodySize() { return bodySize; }
        public void setBodySize(long bodySize) { this.bodySize = bodySize; }
    }

    public static class PostData extends HarFields {
        private String mimeType;
        private List<NameValue> params = new ArrayList<>();
        private String text;

        public PostData() {}

        public PostData(String mimeType, String text) {
            this.mimeType = mimeType;
            this.text = text;
        }

        public String getMimeType() { return mimeType; }
        public void setMimeType(String mimeType) { this.mimeType = mimeType; }

        public List<NameValue> getParams() { return params; }
        public void setParams(List<NameValue> params) { this.params = params; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    @JsonPropertyOrder({"status", "statusText", "httpVersion", "cookies", "headers", "content", "redirectURL", "headersSize", "bodySize"})
    public static class Response extends HarFields {
        private int status;
        private String statusText = "";
        private String httpVersion = "NOT_AVAILABLE";
        private List<Object> cookies = new ArrayList<>();
        private List<NameValue> headers = new ArrayList<>();
        private Content content = new Content();
        @JsonProperty("redirectURL")
        private String redirectUrl = "";
        private long headersSize = -1;
        private long bodySize = -1;

        public Response() {}

        public int getStatus() { return status; }
        public void setStatus(int status) { this.status = status; }

        public String getStatusText() { return statusText; }
        public void setStatusText(String statusText) { this.statusText = statusText; }

        public String getHttpVersion() { return httpVersion; }
        public void setHttpVersion(String httpVersion) { this.httpVersion = httpVersion; }

        public List<Object> getCookies() { return cookies; }
        public void setCookies(List<Object> cookies) { this.cookies = cookies; }

        public List<NameValue> getHeaders() { return headers; }
        public void setHeaders(List<NameValue> headers) { this.headers = headers; }

        public Content getContent() { return content; }
        public void setContent(Content content) { this.content = content; }

        public String getRedirectUrl() { return redirectUrl; }
        public void setRedirectUrl(String redirectUrl) { this.redirectUrl = redirectUrl; }

        public long getHeadersSize() { return headersSize; }
        public void setHeadersSize(long headersSize) { this.headersSize = headersSize; }

        public long getBodySize() { return bodySize; }
        public void setBodySize(long bodySize) { this.bodySize = bodySize; }
    }

    public static class Content extends HarFields {
        private long size;
        private String mimeType = "";
        private String text = "";

        public Content() {}

        public long getSize() { return size; }
        public void setSize(long size) { this.size = size; }

        public String getMimeType() { return mimeType; }
        public void setMimeType(String mimeType) { this.mimeType = mimeType; }

        public String getText() { return text; }
        public void setText(String text) { this.text = text; }
    }

    public static class Timings extends HarFields {
        private long send;
        private long wait;
        private long receive;

        public Timings() {}

        public long getSend() { return send; }
        public void setSend(long send) { this.send = send; }

        public long getWait() { return wait; }
        public void setWait(long wait) { this.wait = wait; }

        public long getReceive() { return receive; }
        public void setReceive(long receive) { this.receive = receive; }
    }
}
