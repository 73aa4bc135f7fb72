package com.namingtool.domain.policy.model;

/**
 * Position and value contributed by one example name.
 *
 * @param fullName   the delimiter-joined example, e.g. {@code "contoso-prod-*"}
 * @param delimiter  component separator
 * @param level      number of delimiter occurrences in {@code fullName}
 * @param startIndex offset where this segment's value begins
 * @param lastIndex  offset of the final delimiter ({@code fullName.length()} when there is none)
 * @param name       {@code fullName[startIndex, lastIndex)}
 * @param fullLength {@code fullName.length() - 1}; children of this segment start here
 */
public record NameSegment(
        String fullName,
        char delimiter,
        int level,
        int startIndex,
        int lastIndex,
        String name,
        int fullLength
) {
    public int length() {
        return name.length();
    }

    public SegmentGroupKey groupKey() {
        return new SegmentGroupKey(level, startIndex, length());
    }
}
