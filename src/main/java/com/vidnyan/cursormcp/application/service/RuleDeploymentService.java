package com.vidnyan.cursormcp.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.cursormcp.application.port.out.RuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Copies locally stored rules into a project's {@code .cursor-rules} directory
 * and keeps that directory's {@code index.json} in step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleDeploymentService {

    public static final String CURSOR_RULES_DIR = ".cursor-rules";
    public static final String INDEX_FILE = "index.json";

    private static final String JSON_SUFFIX = ".json";

    private final RuleRepository ruleRepository;
    private final ObjectMapper objectMapper;

    /**
     * Deploy a technology's rules into the target project.
     * Files copied before a failure stay in place.
     * @return false when there are no local rules for the technology or copying fails
     */
    public boolean deployRules(Path targetDir, String technology) {
        Path targetRulesDir = targetDir.resolve(CURSOR_RULES_DIR);
        Optional<Path> sourceDir = ruleRepository.findTechnologyDirectory(technology);
        if (sourceDir.isEmpty()) {
            log.error("No local rules for technology {}; fetch them before deploying", technology);
            return false;
        }

        log.info("Deploying rules from {} to {}", sourceDir.get(), targetRulesDir);
        try {
            Path targetTechnologyDir = targetRulesDir.resolve(technology);
            Files.createDirectories(targetTechnologyDir);

            for (Path ruleFile : listRuleFiles(sourceDir.get())) {
                Path target = targetTechnologyDir.resolve(ruleFile.getFileName().toString());
                Files.copy(ruleFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                log.debug("Copied rule file: {} -> {}", ruleFile, target);
            }

            updateIndex(targetRulesDir, technology);
            log.info("Successfully deployed rules to {}", targetRulesDir);
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.error("Error deploying rules to {}: {}", targetDir, e.getMessage());
            return false;
        }
    }

    /**
     * Replace the technology's index entry with the rule files now present, keeping other entries.
     */
    private void updateIndex(Path rulesDir, String technology) throws IOException {
        Path indexPath = rulesDir.resolve(INDEX_FILE);
        ObjectNode index = readIndex(indexPath);

        ObjectNode technologies;
        if (index.get("technologies") instanceof ObjectNode existing) {
            technologies = existing;
        } else {
            technologies = index.putObject("technologies");
        }

        ArrayNode ruleIds = objectMapper.createArrayNode();
        for (Path ruleFile : listRuleFiles(rulesDir.resolve(technology))) {
            String fileName = ruleFile.getFileName().toString();
            ruleIds.add(fileName.substring(0, fileName.length() - JSON_SUFFIX.length()));
        }

        ObjectNode entry = technologies.putObject(technology);
        entry.set("rules", ruleIds);
        entry.put("updated", true);

        Files.writeString(indexPath, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(index));
        log.debug("Updated index file at {}", indexPath);
    }

    private ObjectNode readIndex(Path indexPath) {
        if (Files.exists(indexPath)) {
            try {
                JsonNode existing = objectMapper.readTree(indexPath.toFile());
                if (existing instanceof ObjectNode object) {
                    return object;
                }
                log.warn("Index file {} is not a JSON object, starting a new one", indexPath);
            } catch (IOException e) {
                log.warn("Failed to read existing index file {}: {}", indexPath, e.getMessage());
            }
        }
        return objectMapper.createObjectNode();
    }

    private static List<Path> listRuleFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .toList();
        }
    }
}
