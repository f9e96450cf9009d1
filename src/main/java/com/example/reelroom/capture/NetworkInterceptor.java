package com.example.reelroom.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Installs recording decorators on {@link OutboundHttpClients} and puts the originals back on uninstall.
 */
public class NetworkInterceptor {

    private static final Logger log = LoggerFactory.getLogger(NetworkInterceptor.class);

    private final OutboundHttpClients clients;
    private final TraceEntryBuilder builder;
    private final Predicate<URI> ignored;

    private ClientHttpRequestFactory originalFactory;
    private RecordingRestTemplateInterceptor installedInterceptor;

    public NetworkInterceptor(OutboundHttpClients clients, TraceEntryBuilder builder, Predicate<URI> ignored) {
        this.clients = clients;
        this.builder = builder;
        this.ignored = ignored;
    }

    public synchronized boolean isActive() {
        return installedInterceptor != null;
    }

    public synchronized void install(CaptureListener sink) {
        if (installedInterceptor != null) {
            log.warn("network interceptor already installed, ignoring");
            return;
        }
        originalFactory = clients.getRequestFactory();
        clients.setRequestFactory(new RecordingClientHttpRequestFactory(originalFactory, builder, sink, ignored));

        installedInterceptor = new RecordingRestTemplateInterceptor(builder, sink, ignored);
        List<ClientHttpRequestInterceptor> interceptors = new ArrayList<>(clients.getRestTemplate().getInterceptors());
        interceptors.add(installedInterceptor);
        clients.getRestTemplate().setInterceptors(interceptors);
        log.info("network interceptor installed");
    }

    public synchronized void uninstall() {
        if (installedInterceptor == null) {
            log.warn("network interceptor not installed, nothing to remove");
            return;
        }
        clients.setRequestFactory(originalFactory);

        List<ClientHttpRequestInterceptor> interceptors = new ArrayList<>(clients.getRestTemplate().getInterceptors());
        interceptors.remove(installedInterceptor);
        clients.getRestTemplate().setInterceptors(interceptors);

        originalFactory = null;
        installedInterceptor = null;
        log.info("network interceptor removed");
    }
}
