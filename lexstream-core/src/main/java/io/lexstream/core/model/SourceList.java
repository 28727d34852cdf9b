package io.lexstream.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SourceList {
    private final Map<Source.CitationKey, Source> entries = new LinkedHashMap<>();

    public static List<Source> deduplicate(List<Source> sources) {
        SourceList list = new SourceList();
        sources.forEach(list::add);
        return list.toList();
    }

    public boolean add(Source source) {
        return entries.putIfAbsent(source.key(), source) == null;
    }

    public boolean contains(Source source) {
        return entries.containsKey(source.key());
    }

    public int size() {
        return entries.size();
    }

    public List<Source> toList() {
        return List.copyOf(new ArrayList<>(entries.values()));
    }
}
