package com.namingtool.infrastructure.schema;

import com.namingtool.domain.schema.model.ComponentValue;
import com.namingtool.domain.schema.model.NamingComponent;
import com.namingtool.domain.schema.model.NamingDelimiter;
import com.namingtool.domain.schema.model.NamingSchema;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Naming schema bound from {@code naming.schema.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "naming.schema")
public class NamingSchemaProperties {

    private List<DelimiterConfig> delimiters = new ArrayList<>();
    private List<ComponentConfig> components = new ArrayList<>();

    @Getter
    @Setter
    public static class DelimiterConfig {
        private String name;
        private String delimiter;
        private boolean enabled = true;
        private int sortOrder;
    }

    @Getter
    @Setter
    public static class ComponentConfig {
        private String name;
        private String displayName;
        private boolean enabled = true;
        private int sortOrder;
        private List<ValueConfig> values = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class ValueConfig {
        private String name;
        private String shortName;
    }

    public NamingSchema toSchema() {
        List<NamingDelimiter> schemaDelimiters = delimiters.stream()
                .map(NamingSchemaProperties::toDelimiter)
                .toList();

        List<NamingComponent> schemaComponents = components.stream()
                .map(c -> new NamingComponent(
                        c.getName(),
                        c.getDisplayName() != null ? c.getDisplayName() : c.getName(),
                        c.isEnabled(),
                        c.getSortOrder(),
                        c.getValues().stream()
                                .map(v -> new ComponentValue(v.getName(), v.getShortName()))
                                .toList()))
                .toList();

        return new NamingSchema(schemaComponents, schemaDelimiters);
    }

    private static NamingDelimiter toDelimiter(DelimiterConfig d) {
        if (d.getDelimiter() == null || d.getDelimiter().length() != 1) {
            throw new NamingSchemaException(
                    "Delimiter '" + d.getName() + "' must be exactly one character, got: " + d.getDelimiter());
        }
        return new NamingDelimiter(d.getName(), d.getDelimiter().charAt(0), d.isEnabled(), d.getSortOrder());
    }
}
