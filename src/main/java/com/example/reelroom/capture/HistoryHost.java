package com.example.reelroom.capture;

import com.example.reelroom.model.NavigationTrigger;

import java.util.function.Consumer;

/**
 * A page host whose navigation can be observed: its history object can be swapped, and it
 * raises {@link NavigationTrigger#POPSTATE} and {@link NavigationTrigger#HASHCHANGE} signals
 * carrying the new url.
 */
public interface HistoryHost {

    HistoryApi getHistory();

    void setHistory(HistoryApi history);

    String currentUrl();

    void addNavigationListener(NavigationTrigger signal, Consumer<String> listener);

    void removeNavigationListener(NavigationTrigger signal, Consumer<String> listener);
}
