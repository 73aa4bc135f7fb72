package com.namingtool.infrastructure.schema;

import com.namingtool.domain.schema.model.ComponentValue;
import com.namingtool.domain.schema.model.NamingComponent;
import com.namingtool.domain.schema.model.NamingDelimiter;
import com.namingtool.domain.schema.model.NamingSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExampleNameEnumeratorTest {

    private ExampleNameEnumerator enumerator;

    @BeforeEach
    void setUp() {
        enumerator = new ExampleNameEnumerator();
    }

    private static NamingComponent component(String name, int sortOrder, boolean enabled, String... shortNames) {
        List<ComponentValue> values = Arrays.stream(shortNames)
                .map(s -> new ComponentValue(s, s))
                .toList();
        return new NamingComponent(name, name, enabled, sortOrder, values);
    }

    private static NamingSchema schema(List<NamingComponent> components) {
        return new NamingSchema(components, List.of(new NamingDelimiter("dash", '-', true, 1)));
    }

    @Nested
    @DisplayName("enumerate")
    class Enumerate {

        @Test
        @DisplayName("combines components in sort order with wildcard tails")
        void combines_in_sort_order() {
            NamingSchema schema = schema(List.of(
                    component("ResourceEnvironment", 2, true, "dev", "prod"),
                    component("ResourceOrg", 1, true, "org")));

            assertThat(enumerator.enumerate(schema))
                    .containsExactly("org-*", "org-dev-*", "org-prod-*");
        }

        @Test
        @DisplayName("value-major order across prefixes")
        void value_major_order() {
            NamingSchema schema = schema(List.of(
                    component("ResourceOrg", 1, true, "org"),
                    component("ResourceEnvironment", 2, true, "dev", "prod"),
                    component("ResourceLocation", 3, true, "eastus", "westus")));

            assertThat(enumerator.enumerate(schema)).containsExactly(
                    "org-*",
                    "org-dev-*",
                    "org-prod-*",
                    "org-dev-eastus-*",
                    "org-prod-eastus-*",
                    "org-dev-westus-*",
                    "org-prod-westus-*");
        }

        @Test
        @DisplayName("disabled components and blank short names are skipped without leaving a gap")
        void skips_disabled_and_blank() {
            NamingSchema schema = schema(List.of(
                    component("ResourceOrg", 1, true, "org"),
                    component("ResourceUnitDept", 2, false, "it"),
                    component("ResourceFunction", 3, true, " ", ""),
                    component("ResourceType", 4, true, "vm")));

            assertThat(enumerator.enumerate(schema)).containsExactly("org-*", "org-vm-*");
        }

        @Test
        @DisplayName("duplicate short names are emitted once")
        void dedup() {
            NamingSchema schema = schema(List.of(
                    component("ResourceOrg", 1, true, "org", "org")));

            assertThat(enumerator.enumerate(schema)).containsExactly("org-*");
        }

        @Test
        @DisplayName("uses the active delimiter")
        void active_delimiter() {
            NamingSchema schema = new NamingSchema(
                    List.of(component("ResourceOrg", 1, true, "org"), component("ResourceType", 2, true, "vm")),
                    List.of(new NamingDelimiter("dash", '-', false, 1), new NamingDelimiter("underscore", '_', true, 2)));

            assertThat(enumerator.enumerate(schema)).containsExactly("org_*", "org_vm_*");
        }

        @Test
        @DisplayName("empty schema → no examples")
        void empty_schema() {
            assertThat(enumerator.enumerate(schema(List.of()))).isEmpty();
        }
    }

    @Nested
    @DisplayName("expandPrefixes")
    class ExpandPrefixes {

        @Test
        @DisplayName("concrete names become wildcard prefixes, first-seen order")
        void expands() {
            List<String> result = enumerator.expandPrefixes(
                    List.of("org-dev-eastus", "org-prod-eastus", "org-dev-westus"), '-');

            assertThat(result).containsExactly(
                    "org-*",
                    "org-dev-*",
                    "org-dev-eastus-*",
                    "org-prod-*",
                    "org-prod-eastus-*",
                    "org-dev-westus-*");
        }

        @Test
        @DisplayName("existing wildcard tail is not repeated")
        void keeps_existing_wildcard() {
            assertThat(enumerator.expandPrefixes(List.of("org-dev-*"), '-'))
                    .containsExactly("org-*", "org-dev-*");
        }

        @Test
        @DisplayName("regex metacharacter delimiter")
        void dot_delimiter() {
            assertThat(enumerator.expandPrefixes(List.of("org.vm"), '.'))
                    .containsExactly("org.*", "org.vm.*");
        }
    }
}
