package com.namingtool.domain.policy.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Action the governance engine takes when a resource name violates the compiled rule.
 */
public enum PolicyEffect {
    AUDIT,
    DENY;

    /**
     * Lower-case form used inside the policy rule's {@code then} clause.
     */
    public String ruleValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyEffect from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return PolicyEffect.valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
