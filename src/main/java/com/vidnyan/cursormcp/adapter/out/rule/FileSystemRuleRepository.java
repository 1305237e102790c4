package com.vidnyan.cursormcp.adapter.out.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.cursormcp.application.port.out.RuleRepository;
import com.vidnyan.cursormcp.config.RulesProperties;
import com.vidnyan.cursormcp.domain.rule.Rule;
import com.vidnyan.cursormcp.domain.rule.RuleSet;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * File system based rule repository.
 * Writes each rule to {@code <rules dir>/<technology>/<rule id>.json}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRuleRepository implements RuleRepository {

    private final ObjectMapper objectMapper;
    private final RulesProperties properties;

    @PostConstruct
    public void createRulesDirectory() {
        Path root = properties.rulesDirectory();
        try {
            Files.createDirectories(root);
            log.info("Using local rules directory: {}", root.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create rules directory " + root, e);
        }
    }

    @Override
    public int saveAll(String technology, RuleSet ruleSet) {
        Path technologyDir = properties.rulesDirectory().resolve(technology);
        try {
            Files.createDirectories(technologyDir);
        } catch (IOException e) {
            log.error("Cannot create rules directory {}: {}", technologyDir, e.getMessage());
            return 0;
        }

        int saved = 0;
        for (Rule rule : ruleSet.rules()) {
            try {
                Path rulePath = technologyDir.resolve(rule.id() + ".json").normalize();
                if (!technologyDir.normalize().equals(rulePath.getParent())) {
                    log.error("Skipping rule with unsafe id '{}' for {}", rule.id(), technology);
                    continue;
                }
                Files.writeString(rulePath, objectMapper.writeValueAsString(rule));
                saved++;
                log.debug("Saved rule to {}", rulePath);
            } catch (InvalidPathException e) {
                log.error("Skipping rule {} for {}: {}", rule.id(), technology, e.getMessage());
            } catch (IOException e) {
                log.error("Error saving rule {} for {}: {}", rule.id(), technology, e.getMessage());
            }
        }
        return saved;
    }

    @Override
    public Optional<Path> findTechnologyDirectory(String technology) {
        Path technologyDir = properties.rulesDirectory().resolve(technology);
        return Files.isDirectory(technologyDir) ? Optional.of(technologyDir) : Optional.empty();
    }
}
