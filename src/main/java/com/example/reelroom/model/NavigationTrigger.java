package com.example.reelroom.model;

public enum NavigationTrigger {
    INITIAL("initial"),
    PUSH_STATE("pushState"),
    REPLACE_STATE("replaceState"),
    POPSTATE("popstate"),
    HASHCHANGE("hashchange");

    private final String wireName;

    NavigationTrigger(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() { return wireName; }
}
