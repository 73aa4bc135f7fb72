package com.namingtool.domain.schema.model;

import java.util.Comparator;
import java.util.List;

/**
 * Ordered naming convention: components in sort order plus the candidate delimiters.
 */
public record NamingSchema(List<NamingComponent> components, List<NamingDelimiter> delimiters) {

    public static final char DEFAULT_DELIMITER = '-';

    public NamingSchema {
        components = components == null ? List.of() : List.copyOf(components);
        delimiters = delimiters == null ? List.of() : List.copyOf(delimiters);
    }

    /**
     * Enabled components in ascending sort order. Ties keep their configured order.
     */
    public List<NamingComponent> orderedComponents() {
        return components.stream()
                .filter(NamingComponent::enabled)
                .sorted(Comparator.comparingInt(NamingComponent::sortOrder))
                .toList();
    }

    /**
     * The enabled delimiter with the lowest sort order, {@code '-'} when none is enabled.
     */
    public char activeDelimiter() {
        return delimiters.stream()
                .filter(NamingDelimiter::enabled)
                .min(Comparator.comparingInt(NamingDelimiter::sortOrder))
                .map(NamingDelimiter::delimiter)
                .orElse(DEFAULT_DELIMITER);
    }
}
