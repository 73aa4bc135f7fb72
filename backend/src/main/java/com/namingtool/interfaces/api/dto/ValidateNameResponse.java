package com.namingtool.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.namingtool.domain.policy.model.NameEvaluation;
import com.namingtool.domain.policy.model.PolicyCondition;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateNameResponse(
        String name,
        boolean compliant,
        String effect,
        Integer failedOffset,
        Integer failedLength,
        List<String> allowedValues
) {
    public static ValidateNameResponse from(NameEvaluation evaluation) {
        PolicyCondition.ValueIn failed = evaluation.failedCondition();
        return new ValidateNameResponse(
                evaluation.name(),
                evaluation.compliant(),
                evaluation.effect().ruleValue(),
                failed != null ? failed.offset() : null,
                failed != null ? failed.length() : null,
                failed != null ? failed.values() : null);
    }
}
