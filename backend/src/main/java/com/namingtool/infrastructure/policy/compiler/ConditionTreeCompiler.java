package com.namingtool.infrastructure.policy.compiler;

import com.namingtool.domain.policy.model.NameSegment;
import com.namingtool.domain.policy.model.PolicyCondition;
import com.namingtool.domain.policy.model.PolicyCondition.AllOf;
import com.namingtool.domain.policy.model.PolicyCondition.Not;
import com.namingtool.domain.policy.model.PolicyCondition.ValueIn;
import com.namingtool.domain.policy.model.PolicyEffect;
import com.namingtool.domain.policy.model.SegmentGroupKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles parsed example segments into one nested condition tree.
 *
 * Segments are grouped by (level, start, length) in first-seen order. Each group becomes
 * {@code allOf[not(substring in values), children...]}, where children are the groups one
 * level deeper that start exactly at the group's {@code fullLength}, i.e. right after the
 * delimiter that follows it.
 *
 * The root is level 1 at offset 0. The root falls back to level 0 only when every segment is
 * degenerate (no delimiter); mixed with delimited names, level-0 segments are unreachable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionTreeCompiler {

    static final int ROOT_LEVEL = 1;
    static final int DEGENERATE_LEVEL = 0;

    private final PolicyRuleRenderer renderer;

    /**
     * Compile and render the {@code "policyRule"} member for the given effect.
     */
    public String compile(List<NameSegment> segments, PolicyEffect effect) {
        return renderer.renderRule(buildConditionTree(segments), effect);
    }

    public AllOf buildConditionTree(List<NameSegment> segments) {
        Map<SegmentGroupKey, List<NameSegment>> groups = groupByPosition(segments);
        int rootLevel = resolveRootLevel(groups);

        List<PolicyCondition> blocks = generateConditions(groups, rootLevel, 0);
        log.debug("[ConditionTreeCompiler] {} segments, {} groups, {} root blocks",
                segments.size(), groups.size(), blocks.size());
        return new AllOf(blocks);
    }

    Map<SegmentGroupKey, List<NameSegment>> groupByPosition(List<NameSegment> segments) {
        Map<SegmentGroupKey, List<NameSegment>> groups = new LinkedHashMap<>();
        for (NameSegment segment : segments) {
            groups.computeIfAbsent(segment.groupKey(), k -> new ArrayList<>()).add(segment);
        }
        return groups;
    }

    private List<PolicyCondition> generateConditions(Map<SegmentGroupKey, List<NameSegment>> groups,
                                                     int level, int startIndex) {
        List<PolicyCondition> blocks = new ArrayList<>();
        for (Map.Entry<SegmentGroupKey, List<NameSegment>> group : groups.entrySet()) {
            SegmentGroupKey key = group.getKey();
            if (key.level() != level || key.startIndex() != startIndex) {
                continue;
            }

            List<NameSegment> members = group.getValue();
            List<PolicyCondition> conditions = new ArrayList<>();
            conditions.add(new Not(leafCondition(key, members)));

            // Children start right after this segment's trailing delimiter
            int childStart = members.get(0).fullLength();
            conditions.addAll(generateConditions(groups, level + 1, childStart));

            blocks.add(new AllOf(conditions));
        }
        return blocks;
    }

    private ValueIn leafCondition(SegmentGroupKey key, List<NameSegment> members) {
        List<String> allowed = members.stream()
                .map(NameSegment::name)
                .distinct()
                .toList();
        return new ValueIn(key.startIndex(), key.length(), allowed);
    }

    private int resolveRootLevel(Map<SegmentGroupKey, List<NameSegment>> groups) {
        boolean allDegenerate = !groups.isEmpty() && groups.keySet().stream()
                .allMatch(k -> k.level() == DEGENERATE_LEVEL);
        return allDegenerate ? DEGENERATE_LEVEL : ROOT_LEVEL;
    }
}
