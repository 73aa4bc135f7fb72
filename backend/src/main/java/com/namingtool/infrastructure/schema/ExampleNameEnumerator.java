package com.namingtool.infrastructure.schema;

import com.namingtool.domain.schema.model.NamingComponent;
import com.namingtool.domain.schema.model.NamingSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Produces the example names the policy compiler consumes.
 *
 * Every example is a prefix of a legal name followed by the delimiter and {@code *}:
 * {@code cnt-*}, {@code cnt-dev-*}, {@code cnt-dev-eus-*}. The trailing wildcard keeps a
 * parent's {@code fullLength} aligned with the start of its children.
 */
@Slf4j
@Component
public class ExampleNameEnumerator {

    static final String WILDCARD = "*";

    /**
     * Combine the enabled component values in sort order.
     * Components without a usable short name contribute nothing and do not add a level.
     */
    public List<String> enumerate(NamingSchema schema) {
        char delimiter = schema.activeDelimiter();
        Set<String> examples = new LinkedHashSet<>();
        List<String> frontier = List.of("");

        for (NamingComponent component : schema.orderedComponents()) {
            List<String> shortNames = component.shortNames();
            if (shortNames.isEmpty()) {
                log.debug("[ExampleNameEnumerator] Skipping {} (no short names)", component.name());
                continue;
            }

            Set<String> next = new LinkedHashSet<>();
            for (String shortName : shortNames) {
                for (String prefix : frontier) {
                    String extended = prefix + shortName + delimiter;
                    if (examples.add(extended + WILDCARD)) {
                        next.add(extended);
                    }
                }
            }
            frontier = new ArrayList<>(next);
        }

        log.info("[ExampleNameEnumerator] {} example names from {} components",
                examples.size(), schema.orderedComponents().size());
        return List.copyOf(examples);
    }

    /**
     * Turn concrete names into wildcard prefixes: {@code org-dev-eus} becomes
     * {@code org-*}, {@code org-dev-*}, {@code org-dev-eus-*}. A trailing {@code *} component
     * already present in the input is not repeated. Duplicates are dropped, first-seen order kept.
     */
    public List<String> expandPrefixes(List<String> fullNames, char delimiter) {
        String separator = String.valueOf(delimiter);
        Pattern splitter = Pattern.compile(Pattern.quote(separator));
        Set<String> examples = new LinkedHashSet<>();

        for (String fullName : fullNames) {
            String[] parts = splitter.split(fullName, -1);
            int count = parts.length;
            if (count > 1 && WILDCARD.equals(parts[count - 1])) {
                count--;
            }

            StringBuilder prefix = new StringBuilder();
            for (int i = 0; i < count; i++) {
                prefix.append(parts[i]).append(delimiter);
                examples.add(prefix + WILDCARD);
            }
        }
        return List.copyOf(examples);
    }
}
