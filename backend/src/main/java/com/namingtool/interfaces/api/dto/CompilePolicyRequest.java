package com.namingtool.interfaces.api.dto;

import com.namingtool.domain.policy.model.PolicyEffect;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CompilePolicyRequest(
        @NotEmpty(message = "At least one example name is required")
        @Size(max = 5000, message = "No more than 5000 example names are accepted")
        List<@NotBlank(message = "Example names must not be blank") String> names,

        @NotBlank(message = "Delimiter is required")
        @Size(max = 1, message = "Delimiter must be a single character")
        String delimiter,

        PolicyEffect effect,

        @Size(max = 128, message = "Display name must not exceed 128 characters")
        String displayName,

        @Size(max = 512, message = "Description must not exceed 512 characters")
        String description,

        String mode,

        boolean expandPrefixes
) {}
