package com.vidnyan.cursormcp.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.cursormcp.application.service.RuleDeploymentService;
import com.vidnyan.cursormcp.application.service.RuleManager;
import com.vidnyan.cursormcp.domain.rule.FileContext;
import com.vidnyan.cursormcp.domain.rule.Rule;
import com.vidnyan.cursormcp.domain.rule.RuleSet;
import com.vidnyan.cursormcp.domain.technology.TechnologyCatalog;
import com.vidnyan.cursormcp.scanner.ProjectTypeDetector;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;
import java.util.List;

/**
 * REST API for browsing rules and deploying them into projects.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RulesController {

    private final RuleManager ruleManager;
    private final RuleDeploymentService deploymentService;
    private final ProjectTypeDetector projectTypeDetector;

    @GetMapping("/technologies")
    public List<String> listTechnologies() {
        return TechnologyCatalog.ADVERTISED_TECHNOLOGIES;
    }

    @GetMapping("/technologies/{technology}/rules")
    public RuleSet getRulesForTechnology(@PathVariable String technology) {
        requireValidTechnology(technology);
        return ruleManager.getRulesForTechnology(technology);
    }

    @GetMapping("/technologies/{technology}/rules/{ruleId}")
    public Rule getRuleById(@PathVariable String technology, @PathVariable String ruleId) {
        requireValidTechnology(technology);
        return ruleManager.getRuleById(ruleId, technology)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Rule " + ruleId + " not found for " + technology));
    }

    @PostMapping("/context/rules")
    public RuleSet getRulesForContext(@Valid @RequestBody FileContext fileContext) {
        requireValidTechnology(fileContext.resolveTechnology());
        return ruleManager.getRulesForFile(fileContext);
    }

    @PostMapping("/deploy")
    public DeployResponse deployRules(@Valid @RequestBody DeployRequest request) {
        Path targetDir = Path.of(request.targetDir());

        String technology = request.technology();
        if (technology == null || technology.isBlank()) {
            technology = projectTypeDetector.detectProjectType(targetDir)
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                            "Could not detect project type. Please specify technology parameter."));
        }
        requireValidTechnology(technology);

        RuleSet ruleSet = ruleManager.getRulesForTechnology(technology);
        if (ruleSet.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No rules found for technology: " + technology);
        }

        if (!deploymentService.deployRules(targetDir, technology)) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR,
                    "Failed to deploy rules to " + request.targetDir());
        }

        log.info("Deployed {} {} rules to {}", ruleSet.total(), technology, request.targetDir());
        return new DeployResponse(true, technology, ruleSet.total(), request.targetDir());
    }

    private static void requireValidTechnology(String technology) {
        if (!TechnologyCatalog.isValidName(technology)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid technology name: " + technology);
        }
    }

    public record DeployRequest(
        @NotBlank @JsonProperty("target_dir") String targetDir,
        String technology
    ) {}

    public record DeployResponse(
        boolean success,
        String technology,
        @JsonProperty("rules_count") int rulesCount,
        @JsonProperty("target_dir") String targetDir
    ) {}
}
