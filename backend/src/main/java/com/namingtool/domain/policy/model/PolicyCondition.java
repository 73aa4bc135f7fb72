package com.namingtool.domain.policy.model;

import java.util.List;

/**
 * Node of a compiled policy {@code if} tree.
 */
public interface PolicyCondition {

    record AllOf(List<PolicyCondition> conditions) implements PolicyCondition {
        public AllOf {
            conditions = List.copyOf(conditions);
        }
    }

    record Not(PolicyCondition condition) implements PolicyCondition {}

    /**
     * {@code substring(field('name'), offset, length)} must be one of {@code values}.
     */
    record ValueIn(int offset, int length, List<String> values) implements PolicyCondition {
        public ValueIn {
            values = List.copyOf(values);
        }
    }
}
