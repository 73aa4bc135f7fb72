package com.namingtool.infrastructure.policy.parsing;

import com.namingtool.domain.policy.model.NameSegment;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the hierarchical position of one example name.
 *
 * The contributed value is the second-to-last delimited component: it ends at the last
 * delimiter and starts after the delimiter before that one, or at offset 0 when there is none.
 * For {@code "contoso-prod-*"} that is {@code "prod"} at offset 8, level 2.
 *
 * A delimiter at offset 0 never counts as a left bound, so {@code "-a-*"} yields {@code "-a"}.
 * Names without any delimiter are degenerate level-0 segments whose value is the whole name.
 */
@Component
public class SegmentParser {

    public NameSegment parse(String fullName, char delimiter) {
        if (fullName == null || fullName.isEmpty()) {
            throw new IllegalArgumentException("Example name must not be empty");
        }

        int level = countDelimiters(fullName, delimiter);
        int lastIndex = fullName.lastIndexOf(delimiter);
        if (lastIndex < 0) {
            return new NameSegment(fullName, delimiter, 0, 0, fullName.length(), fullName, fullName.length() - 1);
        }

        int previous = fullName.lastIndexOf(delimiter, lastIndex - 1);
        int startIndex = previous > 0 ? previous + 1 : 0;

        return new NameSegment(
                fullName,
                delimiter,
                level,
                startIndex,
                lastIndex,
                fullName.substring(startIndex, lastIndex),
                fullName.length() - 1);
    }

    public List<NameSegment> parseAll(List<String> fullNames, char delimiter) {
        return fullNames.stream()
                .map(name -> parse(name, delimiter))
                .toList();
    }

    private static int countDelimiters(String value, char delimiter) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == delimiter) {
                count++;
            }
        }
        return count;
    }
}
