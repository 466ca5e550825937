package com.sage.gate;

import com.sage.model.SourceResult;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Provider that replays queued outcomes: a List is returned, a Throwable is thrown. Empty queue returns []. */
final class ScriptedProvider implements SearchProvider {

    private final String name;
    private final double requestsPerSecond;
    private final Deque<Object> outcomes = new ArrayDeque<>();
    final AtomicInteger calls = new AtomicInteger();

    ScriptedProvider(String name) {
        this(name, 1000.0);
    }

    ScriptedProvider(String name, double requestsPerSecond) {
        this.name = name;
        this.requestsPerSecond = requestsPerSecond;
    }

    ScriptedProvider thenReturn(List<SourceResult> results) {
        outcomes.add(results);
        return this;
    }

    ScriptedProvider thenThrow(Exception error) {
        outcomes.add(error);
        return this;
    }

    ScriptedProvider thenError(Error error) {
        outcomes.add(error);
        return this;
    }

    ScriptedProvider thenThrow(Exception error, int times) {
        for (int i = 0; i < times; i++) outcomes.add(error);
        return this;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double requestsPerSecond() {
        return requestsPerSecond;
    }

    @Override
    @SuppressWarnings("unchecked")
    public synchronized List<SourceResult> search(String query, int limit, Map<String, String> filters) throws Exception {
        calls.incrementAndGet();
        Object next = outcomes.poll();
        if (next instanceof Exception) throw (Exception) next;
        if (next instanceof Error) throw (Error) next;
        return next == null ? List.of() : (List<SourceResult>) next;
    }

    static SourceResult result(String provider, String url) {
        return SourceResult.success(provider, url, "title " + url, "", 0.8, 1L);
    }
}
