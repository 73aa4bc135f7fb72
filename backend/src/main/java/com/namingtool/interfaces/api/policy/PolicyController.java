package com.namingtool.interfaces.api.policy;

import com.namingtool.application.policy.PolicyAppService;
import com.namingtool.domain.policy.model.NameEvaluation;
import com.namingtool.domain.policy.model.PolicyDocument;
import com.namingtool.domain.policy.model.PolicyEffect;
import com.namingtool.interfaces.api.dto.CompilePolicyRequest;
import com.namingtool.interfaces.api.dto.ValidateNameRequest;
import com.namingtool.interfaces.api.dto.ValidateNameResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/policy")
@RequiredArgsConstructor
public class PolicyController {

    private final PolicyAppService policyAppService;

    @GetMapping("/definition")
    public ResponseEntity<String> getPolicyDefinition(@RequestParam(required = false) PolicyEffect effect) {
        PolicyDocument document = policyAppService.getPolicyDefinition(effect);
        return json(document);
    }

    @PostMapping("/compile")
    public ResponseEntity<String> compile(@Valid @RequestBody CompilePolicyRequest request) {
        PolicyDocument document = policyAppService.compilePolicy(
                request.names(),
                request.delimiter(),
                request.effect(),
                request.displayName(),
                request.description(),
                request.mode(),
                request.expandPrefixes());
        return json(document);
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidateNameResponse> validate(@Valid @RequestBody ValidateNameRequest request) {
        NameEvaluation evaluation = policyAppService.validateName(request.name(), request.effect());
        return ResponseEntity.ok(ValidateNameResponse.from(evaluation));
    }

    private static ResponseEntity<String> json(PolicyDocument document) {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(document.render());
    }
}
