package com.eainde.vendorrisk.fetch;

import com.eainde.vendorrisk.model.DocumentCandidate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory web: registered URLs answer with their page, known failures throw, everything else is 404.
 * URLs are matched after {@link DocumentCandidate#normalize(String)}.
 */
public class StubFetchClient implements FetchClient {

    private final Map<String, FetchResponse> pages = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private final List<String> requested = new CopyOnWriteArrayList<>();
    private volatile boolean failEverything;

    public StubFetchClient html(String url, String html) {
        pages.put(DocumentCandidate.normalize(url), FetchResponse.ok(url, "text/html", html));
        return this;
    }

    public StubFetchClient text(String url, String text) {
        pages.put(DocumentCandidate.normalize(url), FetchResponse.ok(url, "text/plain", text));
        return this;
    }

    public StubFetchClient response(String url, FetchResponse response) {
        pages.put(DocumentCandidate.normalize(url), response);
        return this;
    }

    public StubFetchClient failing(String url) {
        failing.add(DocumentCandidate.normalize(url));
        return this;
    }

    public StubFetchClient failEverything() {
        this.failEverything = true;
        return this;
    }

    public List<String> requested() {
        return List.copyOf(requested);
    }

    @Override
    public FetchResponse get(String url, Duration timeout) throws FetchException {
        requested.add(url);
        String key = DocumentCandidate.normalize(url);
        if (failEverything || failing.contains(key)) {
            throw new FetchException(url, "connection refused");
        }
        FetchResponse page = pages.get(key);
        if (page == null) {
            return new FetchResponse(url, 404, Map.of(), "text/html", new byte[0]);
        }
        return page;
    }
}
