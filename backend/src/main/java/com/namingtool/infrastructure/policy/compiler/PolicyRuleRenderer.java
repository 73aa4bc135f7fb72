package com.namingtool.infrastructure.policy.compiler;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.namingtool.domain.policy.model.PolicyCondition;
import com.namingtool.domain.policy.model.PolicyCondition.AllOf;
import com.namingtool.domain.policy.model.PolicyCondition.Not;
import com.namingtool.domain.policy.model.PolicyCondition.ValueIn;
import com.namingtool.domain.policy.model.PolicyEffect;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Writes a condition tree in the governance engine's policy-rule syntax.
 * Output is built by concatenation; spacing and comma placement are fixed.
 */
@Component
public class PolicyRuleRenderer {

    public String renderRule(AllOf root, PolicyEffect effect) {
        return "\"policyRule\": {\"if\": " + render(root)
                + ", \"then\": {\"effect\":\"" + effect.ruleValue() + "\"}}";
    }

    public String render(PolicyCondition condition) {
        if (condition instanceof AllOf allOf) {
            return "{\"allOf\": ["
                    + allOf.conditions().stream().map(this::render).collect(Collectors.joining(","))
                    + "]}";
        }
        if (condition instanceof Not not) {
            return "{\"not\": " + render(not.condition()) + "}";
        }
        if (condition instanceof ValueIn valueIn) {
            return "{ \"value\": \"[substring(field('name'), " + valueIn.offset() + ", " + valueIn.length() + ")]\""
                    + ",\"in\": [" + valueIn.values().stream().map(PolicyRuleRenderer::quote).collect(Collectors.joining(","))
                    + "]}";
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition.getClass().getSimpleName());
    }

    private static String quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }
}
