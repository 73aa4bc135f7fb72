package com.namingtool.application.policy;

import com.namingtool.application.policy.exception.InvalidNamingInputException;
import com.namingtool.domain.policy.model.NameEvaluation;
import com.namingtool.domain.policy.model.NameSegment;
import com.namingtool.domain.policy.model.PolicyCondition.AllOf;
import com.namingtool.domain.policy.model.PolicyDocument;
import com.namingtool.domain.policy.model.PolicyEffect;
import com.namingtool.domain.schema.model.NamingSchema;
import com.namingtool.infrastructure.policy.compiler.ConditionTreeCompiler;
import com.namingtool.infrastructure.policy.document.PolicyDocumentAssembler;
import com.namingtool.infrastructure.policy.evaluation.PolicyRuleEvaluator;
import com.namingtool.infrastructure.policy.parsing.SegmentParser;
import com.namingtool.infrastructure.schema.ExampleNameEnumerator;
import com.namingtool.infrastructure.schema.NamingSchemaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyAppService {

    private final NamingSchemaProperties schemaProperties;
    private final ExampleNameEnumerator exampleNameEnumerator;
    private final SegmentParser segmentParser;
    private final ConditionTreeCompiler conditionTreeCompiler;
    private final PolicyRuleEvaluator policyRuleEvaluator;
    private final PolicyDocumentAssembler documentAssembler;

    @Value("${policy.display-name:Name Validation}")
    private String displayName;

    @Value("${policy.description:This policy enables you to restrict the name can be specified when deploying a Azure Resource.}")
    private String description;

    @Value("${policy.mode:all}")
    private String mode;

    @Value("${policy.default-effect:DENY}")
    private PolicyEffect defaultEffect;

    /**
     * Policy document for the configured naming schema.
     */
    public PolicyDocument getPolicyDefinition(PolicyEffect effect) {
        PolicyEffect resolved = resolveEffect(effect);
        NamingSchema schema = schemaProperties.toSchema();
        char delimiter = schema.activeDelimiter();

        List<String> examples = exampleNameEnumerator.enumerate(schema);
        String rule = compileRule(examples, delimiter, resolved);

        log.info("[PolicyAppService] Policy definition built from {} examples, delimiter='{}', effect={}",
                examples.size(), delimiter, resolved.ruleValue());
        return documentAssembler.assemble(displayName, description, mode, rule);
    }

    /**
     * Policy document for caller-supplied example names.
     *
     * @param expandPrefixes when true, concrete names such as {@code org-dev-eus} are first
     *                       expanded into their wildcard prefixes
     */
    public PolicyDocument compilePolicy(List<String> names,
                                        String delimiter,
                                        PolicyEffect effect,
                                        String policyDisplayName,
                                        String policyDescription,
                                        String policyMode,
                                        boolean expandPrefixes) {
        char resolvedDelimiter = requireDelimiter(delimiter);
        requireNames(names);

        List<String> examples = expandPrefixes
                ? exampleNameEnumerator.expandPrefixes(names, resolvedDelimiter)
                : names;
        String rule = compileRule(examples, resolvedDelimiter, resolveEffect(effect));

        log.info("[PolicyAppService] Compiled {} supplied names ({} examples, expandPrefixes={})",
                names.size(), examples.size(), expandPrefixes);
        return documentAssembler.assemble(
                isBlank(policyDisplayName) ? displayName : policyDisplayName,
                policyDescription == null ? description : policyDescription,
                isBlank(policyMode) ? mode : policyMode,
                rule);
    }

    /**
     * Evaluate a candidate resource name against the policy compiled from the configured schema.
     */
    public NameEvaluation validateName(String name, PolicyEffect effect) {
        if (isBlank(name)) {
            throw new InvalidNamingInputException("Resource name is required");
        }
        NamingSchema schema = schemaProperties.toSchema();
        List<NameSegment> segments = segmentParser.parseAll(
                exampleNameEnumerator.enumerate(schema), schema.activeDelimiter());
        AllOf tree = conditionTreeCompiler.buildConditionTree(segments);

        return policyRuleEvaluator.evaluate(tree, name, resolveEffect(effect));
    }

    private String compileRule(List<String> examples, char delimiter, PolicyEffect effect) {
        List<NameSegment> segments = segmentParser.parseAll(examples, delimiter);
        return conditionTreeCompiler.compile(segments, effect);
    }

    private PolicyEffect resolveEffect(PolicyEffect effect) {
        return effect != null ? effect : defaultEffect;
    }

    private static char requireDelimiter(String delimiter) {
        if (delimiter == null || delimiter.length() != 1) {
            throw new InvalidNamingInputException("Delimiter must be exactly one character");
        }
        return delimiter.charAt(0);
    }

    private static void requireNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            throw new InvalidNamingInputException("At least one example name is required");
        }
        if (names.stream().anyMatch(PolicyAppService::isBlank)) {
            throw new InvalidNamingInputException("Example names must not be blank");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
