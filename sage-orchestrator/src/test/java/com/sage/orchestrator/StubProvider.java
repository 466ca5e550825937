package com.sage.orchestrator;

import com.sage.gate.SearchProvider;
import com.sage.model.SourceResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Provider answering every query through a function; records the queries it saw. */
public final class StubProvider implements SearchProvider {

    private final String name;
    private final Function<String, List<SourceResult>> answers;
    public final List<String> queries = new ArrayList<>();

    public StubProvider(String name, Function<String, List<SourceResult>> answers) {
        this.name = name;
        this.answers = answers;
    }

    public static StubProvider empty(String name) {
        return new StubProvider(name, q -> List.of());
    }

    public static StubProvider fixed(String name, List<SourceResult> results) {
        return new StubProvider(name, q -> results);
    }

    public static SourceResult result(String provider, String url, String title, String snippet) {
        return SourceResult.success(provider, url, title, snippet, 0.9, 1L);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public double requestsPerSecond() {
        return 1000.0;
    }

    @Override
    public synchronized List<SourceResult> search(String query, int limit, Map<String, String> filters) {
        queries.add(query);
        return answers.apply(query);
    }
}
