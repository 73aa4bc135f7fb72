package com.namingtool.infrastructure.policy.parsing;

import com.namingtool.domain.policy.model.NameSegment;
import com.namingtool.domain.policy.model.SegmentGroupKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SegmentParserTest {

    private SegmentParser parser;

    @BeforeEach
    void setUp() {
        parser = new SegmentParser();
    }

    @Nested
    @DisplayName("Wildcard prefix examples")
    class WildcardExamples {

        @Test
        @DisplayName("first component: value starts at offset 0")
        void first_level() {
            NameSegment segment = parser.parse("org-*", '-');

            assertThat(segment.level()).isEqualTo(1);
            assertThat(segment.startIndex()).isZero();
            assertThat(segment.lastIndex()).isEqualTo(3);
            assertThat(segment.name()).isEqualTo("org");
            assertThat(segment.length()).isEqualTo(3);
            assertThat(segment.fullLength()).isEqualTo(4);
        }

        @Test
        @DisplayName("second component: value bounded by the delimiter before it")
        void second_level() {
            NameSegment segment = parser.parse("org-prod-*", '-');

            assertThat(segment.level()).isEqualTo(2);
            assertThat(segment.startIndex()).isEqualTo(4);
            assertThat(segment.lastIndex()).isEqualTo(8);
            assertThat(segment.name()).isEqualTo("prod");
            assertThat(segment.fullLength()).isEqualTo(9);
        }

        @Test
        @DisplayName("child start index equals parent fullLength")
        void child_aligns_with_parent() {
            NameSegment parent = parser.parse("org-dev-*", '-');
            NameSegment child = parser.parse("org-dev-eastus-*", '-');

            assertThat(child.level()).isEqualTo(parent.level() + 1);
            assertThat(child.startIndex()).isEqualTo(parent.fullLength());
            assertThat(child.name()).isEqualTo("eastus");
        }

        @Test
        @DisplayName("non-dash delimiter")
        void underscore_delimiter() {
            NameSegment segment = parser.parse("cnt_dev_eus_*", '_');

            assertThat(segment.level()).isEqualTo(3);
            assertThat(segment.startIndex()).isEqualTo(8);
            assertThat(segment.name()).isEqualTo("eus");
        }
    }

    @Nested
    @DisplayName("Concrete names")
    class ConcreteNames {

        @Test
        @DisplayName("value is the second-to-last component")
        void second_to_last_component() {
            NameSegment segment = parser.parse("contoso-prod-eastus-webapp", '-');

            assertThat(segment.level()).isEqualTo(3);
            assertThat(segment.name()).isEqualTo("eastus");
            assertThat(segment.startIndex()).isEqualTo(13);
            assertThat(segment.lastIndex()).isEqualTo(19);
        }

        @Test
        @DisplayName("group key is (level, start, length) and ignores the value")
        void group_key_is_positional() {
            NameSegment dev = parser.parse("org-dev-*", '-');
            NameSegment tst = parser.parse("org-tst-*", '-');

            assertThat(dev.groupKey()).isEqualTo(new SegmentGroupKey(2, 4, 3));
            assertThat(tst.groupKey()).isEqualTo(dev.groupKey());
            assertThat(tst.name()).isNotEqualTo(dev.name());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("no delimiter → degenerate level-0 segment holding the whole name")
        void no_delimiter() {
            NameSegment segment = parser.parse("contoso", '-');

            assertThat(segment.level()).isZero();
            assertThat(segment.startIndex()).isZero();
            assertThat(segment.name()).isEqualTo("contoso");
            assertThat(segment.fullLength()).isEqualTo(6);
        }

        @Test
        @DisplayName("leading delimiter is not a left bound")
        void leading_delimiter() {
            NameSegment segment = parser.parse("-a-*", '-');

            assertThat(segment.startIndex()).isZero();
            assertThat(segment.name()).isEqualTo("-a");
        }

        @Test
        @DisplayName("name that starts with its only delimiter yields an empty value")
        void delimiter_first() {
            NameSegment segment = parser.parse("-*", '-');

            assertThat(segment.level()).isEqualTo(1);
            assertThat(segment.name()).isEmpty();
            assertThat(segment.length()).isZero();
        }

        @Test
        @DisplayName("empty or null name is rejected")
        void empty_name() {
            assertThatThrownBy(() -> parser.parse("", '-')).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> parser.parse(null, '-')).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("parseAll keeps input order")
    void parse_all_order() {
        List<NameSegment> segments = parser.parseAll(List.of("b-*", "a-*", "a-x-*"), '-');

        assertThat(segments).extracting(NameSegment::name).containsExactly("b", "a", "x");
    }
}
