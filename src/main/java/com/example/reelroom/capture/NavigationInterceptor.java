package com.example.reelroom.capture;

import com.example.reelroom.model.NavigationTrigger;
import com.example.reelroom.model.RenderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.function.Consumer;

/**
 * Emits a url-change marker for the initial location and for every history transition of a host.
 */
public class NavigationInterceptor {

    private static final Logger log = LoggerFactory.getLogger(NavigationInterceptor.class);

    private final Clock clock;

    private volatile HistoryHost host;
    private HistoryApi originalHistory;
    private volatile Consumer<RenderEvent> sink;
    private Consumer<String> popstateListener;
    private Consumer<String> hashchangeListener;

    public NavigationInterceptor(Clock clock) {
        this.clock = clock;
    }

    public synchronized boolean isActive() {
        return host != null;
    }

    public synchronized void install(HistoryHost host, Consumer<RenderEvent> sink) {
        if (this.host != null) {
            log.warn("navigation interceptor already installed, ignoring");
            return;
        }
        this.host = host;
        this.sink = sink;
        this.originalHistory = host.getHistory();

        emit(host.currentUrl(), NavigationTrigger.INITIAL);

        host.setHistory(new RecordingHistory(originalHistory));
        popstateListener = url -> emit(url, NavigationTrigger.POPSTATE);
        hashchangeListener = url -> emit(url, NavigationTrigger.HASHCHANGE);
        host.addNavigationListener(NavigationTrigger.POPSTATE, popstateListener);
        host.addNavigationListener(NavigationTrigger.HASHCHANGE, hashchangeListener);
    }

    public synchronized void uninstall() {
        if (host == null) {
            log.warn("navigation interceptor not installed, nothing to remove");
            return;
        }
        host.setHistory(originalHistory);
        host.removeNavigationListener(NavigationTrigger.POPSTATE, popstateListener);
        host.removeNavigationListener(NavigationTrigger.HASHCHANGE, hashchangeListener);

        host = null;
        originalHistory = null;
        sink = null;
        popstateListener = null;
        hashchangeListener = null;
    }

    private void emit(String url, NavigationTrigger trigger) {
        Consumer<RenderEvent> target = sink;
        if (target == null) return;
        try {
            target.accept(RenderEvent.navigation(url, trigger, clock.millis()));
        } catch (RuntimeException e) {
            log.error("navigation marker dropped ({} -> {})", trigger.getWireName(), url, e);
        }
    }

    private final class RecordingHistory implements HistoryApi {
        private final HistoryApi original;

        RecordingHistory(HistoryApi original) {
            this.original = original;
        }

        @Override
        public void pushState(Object state, String title, String url) {
            original.pushState(state, title, url);
            emit(currentUrl(url), NavigationTrigger.PUSH_STATE);
        }

        @Override
        public void replaceState(Object state, String title, String url) {
            original.replaceState(state, title, url);
            emit(currentUrl(url), NavigationTrigger.REPLACE_STATE);
        }

        private String currentUrl(String fallback) {
            HistoryHost h = host;
            return h == null ? fallback : h.currentUrl();
        }
    }
}
