package com.namingtool.interfaces.api.dto;

import com.namingtool.domain.policy.model.PolicyEffect;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ValidateNameRequest(
        @NotBlank(message = "Resource name is required")
        @Size(max = 260, message = "Resource name must not exceed 260 characters")
        String name,

        PolicyEffect effect
) {}
