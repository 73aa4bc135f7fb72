package com.namingtool.infrastructure.policy.document;

import com.namingtool.domain.policy.model.PolicyDocument;
import com.namingtool.domain.policy.model.PolicyProperty;
import com.namingtool.domain.policy.model.PropertyMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Wraps compiled rules into named policy properties and a document.
 */
@Component
public class PolicyDocumentAssembler {

    @Value("${policy.metadata.version:1.0.0}")
    private String metadataVersion;

    @Value("${policy.metadata.category:Azure}")
    private String metadataCategory;

    public PolicyDocument assemble(String name, String description, String mode, String compiledRule) {
        return PolicyDocument.of(property(name, description, mode, compiledRule));
    }

    public PolicyDocument assemble(List<PolicyProperty> properties) {
        return new PolicyDocument(properties);
    }

    public PolicyProperty property(String name, String description, String mode, String compiledRule) {
        return PolicyProperty.of(name, description, mode)
                .withMetadata(new PropertyMetadata(metadataVersion, metadataCategory))
                .withPolicyRule(compiledRule);
    }
}
