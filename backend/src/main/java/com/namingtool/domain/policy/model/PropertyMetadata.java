package com.namingtool.domain.policy.model;

import static com.namingtool.domain.policy.model.PolicyProperty.quote;

public record PropertyMetadata(String version, String category) {

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_CATEGORY = "Azure";

    public PropertyMetadata {
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    public static PropertyMetadata defaults() {
        return new PropertyMetadata(DEFAULT_VERSION, DEFAULT_CATEGORY);
    }

    public String render() {
        return "\"metadata\": { \"version\": " + quote(version) + ", \"category\": " + quote(category) + " }";
    }
}
