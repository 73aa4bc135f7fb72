package com.namingtool.domain.policy.model;

/**
 * Outcome of evaluating a candidate name against a compiled rule.
 *
 * @param name            the candidate resource name
 * @param compliant       false when the rule's effect would fire
 * @param effect          the effect that fires on violation
 * @param failedCondition first membership check the name did not satisfy (nullable)
 */
public record NameEvaluation(
        String name,
        boolean compliant,
        PolicyEffect effect,
        PolicyCondition.ValueIn failedCondition
) {}
