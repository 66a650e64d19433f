package com.example.wormhole.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Identifier (either platform) to shard-relative path.
 * Derived from the stored records and rebuilt wholesale; never the source of truth.
 */
public final class MappingIndex {

    private final Map<String, String> entries;

    private MappingIndex(Map<String, String> entries) {
        this.entries = entries;
    }

    public static MappingIndex empty() {
        return new MappingIndex(new TreeMap<>());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static MappingIndex of(Map<String, String> entries) {
        return new MappingIndex(entries == null ? new TreeMap<>() : new TreeMap<>(entries));
    }

    public void put(String id, String relativePath) {
        entries.put(id, relativePath);
    }

    public Optional<String> pathOf(String id) {
        return Optional.ofNullable(entries.get(id));
    }

    public int size() {
        return entries.size();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MappingIndex other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "MappingIndex" + entries;
    }
}
