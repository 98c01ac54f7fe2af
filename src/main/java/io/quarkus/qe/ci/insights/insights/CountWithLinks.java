package io.quarkus.qe.ci.insights.insights;

import io.quarkus.runtime.annotations.RegisterForReflection;

import java.util.List;

/**
 * A count backed by links to the pipelines or jobs it was computed from.
 * The count may exceed the number of links when some occurrence has no record to point at.
 */
@RegisterForReflection
public record CountWithLinks(int count, List<String> links) {

    private static final CountWithLinks EMPTY = new CountWithLinks(0, List.of());

    public CountWithLinks {
        links = List.copyOf(links);
    }

    public static CountWithLinks empty() {
        return EMPTY;
    }

    public static CountWithLinks of(List<String> links) {
        return new CountWithLinks(links.size(), links);
    }
}
