package com.namingtool.domain.policy.model;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * One named policy definition inside a {@link PolicyDocument}.
 * Instances are immutable; {@link #withPolicyRule(String)} returns a copy carrying the compiled rule.
 *
 * @param displayName display name shown by the governance portal
 * @param policyType  definition type, {@code Custom} for generated policies
 * @param mode        resource scope qualifier, {@code all} by default
 * @param description free text
 * @param metadata    version and category tags
 * @param policyRule  compiled {@code "policyRule": {...}} member, empty until attached
 */
public record PolicyProperty(
        String displayName,
        String policyType,
        String mode,
        String description,
        PropertyMetadata metadata,
        String policyRule
) {
    public static final String DEFAULT_MODE = "all";
    public static final String DEFAULT_POLICY_TYPE = "Custom";

    public PolicyProperty {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Policy display name is required");
        }
        policyType = policyType == null || policyType.isBlank() ? DEFAULT_POLICY_TYPE : policyType;
        mode = mode == null || mode.isBlank() ? DEFAULT_MODE : mode;
        description = description == null ? "" : description;
        metadata = metadata == null ? PropertyMetadata.defaults() : metadata;
        policyRule = policyRule == null ? "" : policyRule;
    }

    public static PolicyProperty of(String displayName, String description, String mode) {
        return new PolicyProperty(displayName, DEFAULT_POLICY_TYPE, mode, description, PropertyMetadata.defaults(), "");
    }

    public PolicyProperty withPolicyRule(String compiledRule) {
        return new PolicyProperty(displayName, policyType, mode, description, metadata, compiledRule);
    }

    public PolicyProperty withMetadata(PropertyMetadata newMetadata) {
        return new PolicyProperty(displayName, policyType, mode, description, newMetadata, policyRule);
    }

    public String render() {
        StringBuilder sb = new StringBuilder("{");
        sb.append("\"displayName\": ").append(quote(displayName)).append(", ");
        sb.append("\"policyType\": ").append(quote(policyType)).append(", ");
        sb.append("\"mode\": ").append(quote(mode)).append(", ");
        sb.append("\"description\": ").append(quote(description)).append(", ");
        sb.append(metadata.render());
        if (!policyRule.isEmpty()) {
            sb.append(", ").append(policyRule);
        }
        return sb.append("}").toString();
    }

    static String quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }
}
