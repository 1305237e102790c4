package com.vidnyan.cursormcp.adapter.out.github;

import com.vidnyan.cursormcp.domain.rule.Rule;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Built-in rules served when GitHub cannot be reached.
 */
@Component
public class MockRuleCatalog {

    private static final String VERSION = "1.0.0";

    private final Map<String, List<Rule>> rulesByTechnology = Map.of(
            "python", List.of(
                    new Rule("python-linting", "python", List.of("*.py"),
                            Map.of("linters", List.of("flake8", "black"),
                                    "rules", Map.of("max_line_length", 88)),
                            VERSION, null),
                    new Rule("python-typing", "python", List.of("*.py"),
                            Map.of("type_checker", "mypy",
                                    "rules", Map.of("disallow_untyped_defs", true)),
                            VERSION, null)),
            "javascript", List.of(
                    new Rule("javascript-eslint", "javascript", List.of("*.js", "*.jsx"),
                            Map.of("linter", "eslint",
                                    "rules", Map.of("semi", "error", "quotes", List.of("error", "single"))),
                            VERSION, null)),
            "typescript", List.of(
                    new Rule("typescript-tslint", "typescript", List.of("*.ts", "*.tsx"),
                            Map.of("linter", "tslint",
                                    "rules", Map.of("indent", List.of(true, "spaces", 2))),
                            VERSION, null)),
            "swift", List.of(
                    new Rule("swift-swiftlint", "swift", List.of("*.swift"),
                            Map.of("linter", "swiftlint",
                                    "rules", Map.of("line_length", 120, "force_cast", "warning")),
                            VERSION, null)));

    /**
     * Mock rules for a technology, empty when there are none.
     */
    public List<Rule> rulesFor(String technology) {
        return rulesByTechnology.getOrDefault(technology, List.of());
    }
}
