package com.example.reelroom.capture;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Matches urls containing any of the configured fragments. Blank fragments are dropped.
 */
public final class UrlIgnorePredicate implements Predicate<URI> {

    private final List<String> fragments = new ArrayList<>();

    public UrlIgnorePredicate(Collection<String> fragments) {
        if (fragments == null) return;
        for (String f : fragments) {
            if (f != null && !f.isBlank()) this.fragments.add(f.trim());
        }
    }

    public static UrlIgnorePredicate none() {
        return new UrlIgnorePredicate(null);
    }

    public List<String> getFragments() { return fragments; }

    @Override
    public boolean test(URI uri) {
        if (uri == null || fragments.isEmpty()) return false;
        String url = uri.toString();
        for (String f : fragments) {
            if (url.contains(f)) return true;
        }
        return false;
    }
}
