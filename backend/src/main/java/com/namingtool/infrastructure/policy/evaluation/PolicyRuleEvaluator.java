package com.namingtool.infrastructure.policy.evaluation;

import com.namingtool.domain.policy.model.NameEvaluation;
import com.namingtool.domain.policy.model.PolicyCondition;
import com.namingtool.domain.policy.model.PolicyCondition.AllOf;
import com.namingtool.domain.policy.model.PolicyCondition.Not;
import com.namingtool.domain.policy.model.PolicyCondition.ValueIn;
import com.namingtool.domain.policy.model.PolicyEffect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Evaluates a compiled {@code if} tree against a resource name the way the governance engine does.
 *
 * Rules:
 *   - allOf: true when every child is true (empty allOf is true)
 *   - not: negation
 *   - value in: exact, case-sensitive membership of {@code substring(name, offset, length)}
 *
 * A substring that runs past the end of the name evaluates to the empty string.
 * The engine raises an error there instead, which never matches an allowed value either.
 */
@Slf4j
@Component
public class PolicyRuleEvaluator {

    /**
     * A root without conditions means there is no schema to enforce, so every name is compliant.
     */
    public NameEvaluation evaluate(AllOf root, String candidateName, PolicyEffect effect) {
        boolean fires = !root.conditions().isEmpty() && matches(root, candidateName);
        ValueIn failed = fires ? firstFailedCondition(root, candidateName).orElse(null) : null;

        if (fires) {
            log.info("[PolicyRuleEvaluator] '{}' violates naming rule, effect={}", candidateName, effect.ruleValue());
        }
        return new NameEvaluation(candidateName, !fires, effect, failed);
    }

    /**
     * True when the condition holds for the name, i.e. for the root, when the effect fires.
     */
    public boolean matches(PolicyCondition condition, String candidateName) {
        if (condition instanceof AllOf allOf) {
            return allOf.conditions().stream().allMatch(c -> matches(c, candidateName));
        }
        if (condition instanceof Not not) {
            return !matches(not.condition(), candidateName);
        }
        if (condition instanceof ValueIn valueIn) {
            return valueIn.values().contains(substring(candidateName, valueIn.offset(), valueIn.length()));
        }
        throw new IllegalArgumentException("Unsupported condition: " + condition.getClass().getSimpleName());
    }

    private Optional<ValueIn> firstFailedCondition(PolicyCondition condition, String candidateName) {
        if (condition instanceof ValueIn valueIn) {
            return matches(valueIn, candidateName) ? Optional.empty() : Optional.of(valueIn);
        }
        if (condition instanceof Not not) {
            return firstFailedCondition(not.condition(), candidateName);
        }
        if (condition instanceof AllOf allOf) {
            for (PolicyCondition child : allOf.conditions()) {
                Optional<ValueIn> failed = firstFailedCondition(child, candidateName);
                if (failed.isPresent()) {
                    return failed;
                }
            }
        }
        return Optional.empty();
    }

    static String substring(String value, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > value.length()) {
            return "";
        }
        return value.substring(offset, offset + length);
    }
}
