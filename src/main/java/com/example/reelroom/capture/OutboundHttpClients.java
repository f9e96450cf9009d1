package com.example.reelroom.capture;

import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;

/**
 * The two outbound HTTP primitives application code goes through. Recording swaps the request
 * factory and adds an interceptor to the template; nothing else holds on to either.
 *
 * <p>The template sits directly on the base factory, so a template call is recorded once as
 * {@code fetch} and never a second time as {@code xhr}.
 *
 * <p>Only calls made through this bean are recorded. The service itself sends nothing through it:
 * uploads and replay downloads use the separate {@code transferRestTemplate}, so a running recorder
 * captures just the traffic that an embedding host routes here.
 */
public class OutboundHttpClients {

    private volatile ClientHttpRequestFactory requestFactory;
    private final RestTemplate restTemplate;

    public OutboundHttpClients(ClientHttpRequestFactory baseFactory) {
        this.requestFactory = baseFactory;
        this.restTemplate = new RestTemplate(baseFactory);
    }

    public ClientHttpRequestFactory getRequestFactory() { return requestFactory; }
    public void setRequestFactory(ClientHttpRequestFactory requestFactory) { this.requestFactory = requestFactory; }

    public RestTemplate getRestTemplate() { return restTemplate; }

    public ClientHttpRequest createRequest(URI uri, HttpMethod method) throws IOException {
        return requestFactory.createRequest(uri, method);
    }
}
