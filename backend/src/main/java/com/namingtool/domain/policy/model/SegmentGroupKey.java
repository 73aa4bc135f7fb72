package com.namingtool.domain.policy.model;

/**
 * Structural position of a segment inside a naming convention.
 * Equality is position equality: two segments with the same key are alternative values
 * for the same component slot, whatever their literal value.
 */
public record SegmentGroupKey(int level, int startIndex, int length) {}
