package com.namingtool.domain.schema.model;

/**
 * One selectable value of a naming component, e.g. {@code ("East US", "eus")}.
 */
public record ComponentValue(String name, String shortName) {

    public boolean hasShortName() {
        return shortName != null && !shortName.isBlank();
    }
}
