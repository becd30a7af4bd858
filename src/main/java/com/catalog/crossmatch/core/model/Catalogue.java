package com.catalog.crossmatch.core.model;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.UnaryOperator;

/**
 * Immutable table of canonical source records.
 */
public final class Catalogue {

    private final String name;
    private final CatalogueRole role;
    private final List<SourceRecord> sources;
    private final Double frequencyMHz;

    public Catalogue(String name, CatalogueRole role, List<SourceRecord> sources) {
        this(name, role, sources, null);
    }

    public Catalogue(String name, CatalogueRole role, List<SourceRecord> sources, Double frequencyMHz) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.role = Objects.requireNonNull(role, "role is required");
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources is required"));
        this.frequencyMHz = frequencyMHz;
    }

    public String getName() {
        return name;
    }

    public CatalogueRole getRole() {
        return role;
    }

    public List<SourceRecord> getSources() {
        return sources;
    }

    /**
     * Frequency the fluxes refer to, if known.
     */
    public OptionalDouble getFrequencyMHz() {
        return frequencyMHz != null ? OptionalDouble.of(frequencyMHz) : OptionalDouble.empty();
    }

    public int size() {
        return sources.size();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public SourceRecord get(int index) {
        return sources.get(index);
    }

    /**
     * Returns a catalogue with the same name, role and frequency over other sources.
     */
    public Catalogue withSources(List<SourceRecord> newSources) {
        return new Catalogue(name, role, newSources, frequencyMHz);
    }

    /**
     * Returns a catalogue with every source transformed.
     */
    public Catalogue map(UnaryOperator<SourceRecord> transform) {
        return withSources(sources.stream().map(transform).toList());
    }

    @Override
    public String toString() {
        return "Catalogue{name='" + name + "', role=" + role + ", sources=" + sources.size() + '}';
    }
}
