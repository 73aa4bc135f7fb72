package com.namingtool.domain.policy.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable set of policy properties. Rendered by string concatenation because the
 * governance engine consumes the raw text.
 */
public record PolicyDocument(List<PolicyProperty> properties) {

    public PolicyDocument {
        if (properties == null || properties.isEmpty()) {
            throw new IllegalArgumentException("A policy document needs at least one property");
        }
        properties = List.copyOf(properties);
    }

    public static PolicyDocument of(PolicyProperty property) {
        return new PolicyDocument(List.of(property));
    }

    /**
     * A single property renders as an object, several as an array.
     */
    public String render() {
        if (properties.size() == 1) {
            return "{ \"properties\": " + properties.get(0).render() + "}";
        }
        return "{ \"properties\": ["
                + properties.stream().map(PolicyProperty::render).collect(Collectors.joining(","))
                + "]}";
    }
}
