package com.namingtool.domain.schema.model;

import java.util.List;

public record NamingComponent(
        String name,
        String displayName,
        boolean enabled,
        int sortOrder,
        List<ComponentValue> values
) {
    public NamingComponent {
        values = values == null ? List.of() : List.copyOf(values);
    }

    /**
     * Short names that contribute to example names, blanks skipped, first occurrence kept.
     */
    public List<String> shortNames() {
        return values.stream()
                .filter(ComponentValue::hasShortName)
                .map(ComponentValue::shortName)
                .distinct()
                .toList();
    }
}
