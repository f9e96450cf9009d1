package com.example.reelroom.capture;

/**
 * Session-history mutators of a page host.
 */
public interface HistoryApi {

    void pushState(Object state, String title, String url);

    void replaceState(Object state, String title, String url);
}
