package com.vidnyan.cursormcp.adapter.out.github;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.cursormcp.application.port.out.RuleSource;
import com.vidnyan.cursormcp.config.RulesProperties;
import com.vidnyan.cursormcp.domain.rule.Rule;
import com.vidnyan.cursormcp.domain.technology.TechnologyCatalog;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule source backed by a GitHub repository.
 *
 * Rules live as JSON files under {@code rules/<technology>/}. When the repository
 * cannot be reached at startup the client serves {@link MockRuleCatalog} rules
 * for as long as it lives.
 */
@Slf4j
@Component
public class GitHubRuleSource implements RuleSource {

    enum ConnectionState {
        CONNECTED,
        DEGRADED
    }

    private static final String RULES_ROOT = "rules";
    private static final String JSON_SUFFIX = ".json";
    private static final String API_VERSION = "2022-11-28";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final MockRuleCatalog mockRules;
    private final RulesProperties.Github github;
    private final String apiBase;

    private volatile ConnectionState state = ConnectionState.DEGRADED;

    public GitHubRuleSource(ObjectMapper objectMapper, RulesProperties properties, MockRuleCatalog mockRules) {
        this.objectMapper = objectMapper;
        this.mockRules = mockRules;
        this.github = properties.getGithub();
        this.apiBase = stripTrailingSlash(github.getApiUrl());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(github.getTimeout())
                .build();
    }

    /**
     * Check the repository once. Failure switches the client to mock rules for good.
     */
    @PostConstruct
    public void connect() {
        if (github.hasToken()) {
            log.info("Using authenticated GitHub access");
        } else {
            log.info("Using anonymous GitHub access");
        }

        try {
            getJson("/repos/" + github.getRepository());
            state = ConnectionState.CONNECTED;
            log.info("Successfully connected to repository: {}", github.getRepository());
        } catch (Exception e) {
            state = ConnectionState.DEGRADED;
            log.warn("Failed to connect to GitHub repository {}: {}", github.getRepository(), e.getMessage());
            log.warn("Falling back to built-in mock rules");
        }
    }

    @Override
    public List<Rule> fetchRulesForTechnology(String technology) {
        log.info("Fetching rules for technology: {}", technology);

        if (state == ConnectionState.DEGRADED) {
            return mockRules.rulesFor(technology);
        }

        try {
            return fetchFromRepository(technology);
        } catch (Exception e) {
            log.error("Error fetching rules for {}: {}", technology, e.getMessage());
            return mockRules.rulesFor(technology);
        }
    }

    @Override
    public List<Rule> fetchRulesByFilePattern(String filePath) {
        log.info("Fetching rules for file: {}", filePath);
        return fetchRulesForTechnology(TechnologyCatalog.technologyForPath(filePath));
    }

    ConnectionState connectionState() {
        return state;
    }

    private List<Rule> fetchFromRepository(String technology) throws IOException {
        List<Rule> rules = new ArrayList<>();
        for (JsonNode entry : listRuleDirectory(technology)) {
            String name = entry.path("name").asText();
            if (!"file".equals(entry.path("type").asText()) || !name.endsWith(JSON_SUFFIX)) {
                continue;
            }
            String path = entry.path("path").asText(name);
            String json = downloadFile(path);
            parseRule(json, name, path, technology).ifPresent(rules::add);
        }
        log.info("Fetched {} rules for {} from {}", rules.size(), technology, github.getRepository());
        return rules;
    }

    /**
     * Contents of {@code rules/<technology>}, or of the repository root when that path does not exist.
     */
    private JsonNode listRuleDirectory(String technology) throws IOException {
        String path = RULES_ROOT + "/" + technology;
        JsonNode listing;
        try {
            listing = getJson(contentsPath(path));
        } catch (GitHubApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.warn("Path {} not found in repository, listing repository root", path);
            listing = getJson(contentsPath(""));
        }

        if (!listing.isArray()) {
            throw new GitHubApiException(200, "Expected a directory listing for " + path);
        }
        return listing;
    }

    private String downloadFile(String path) throws IOException {
        JsonNode file = getJson(contentsPath(path));
        String encoded = file.path("content").asText("");
        if (!"base64".equals(file.path("encoding").asText("base64"))) {
            return encoded;
        }
        return new String(Base64.getMimeDecoder().decode(encoded), StandardCharsets.UTF_8);
    }

    private Optional<Rule> parseRule(String json, String fileName, String path, String technology) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!(node instanceof ObjectNode ruleData)) {
                log.error("Rule file {} does not hold a JSON object", path);
                return Optional.empty();
            }

            if (!ruleData.hasNonNull("id")) {
                ruleData.put("id", fileName.substring(0, fileName.length() - JSON_SUFFIX.length()));
            }
            if (!ruleData.hasNonNull("technology")) {
                ruleData.put("technology", technology);
            }
            if (!ruleData.hasNonNull("updated_at")) {
                lastCommitDate(path).ifPresent(date -> ruleData.put("updated_at", date));
            }

            return Optional.of(toRule(objectMapper.treeToValue(ruleData, RuleDto.class)));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Error parsing rule from {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Author date of the newest commit touching the file. Best effort.
     */
    private Optional<String> lastCommitDate(String path) {
        try {
            JsonNode commits = getJson("/repos/" + github.getRepository()
                    + "/commits?path=" + URLEncoder.encode(path, StandardCharsets.UTF_8) + "&per_page=1");
            if (commits.isArray() && !commits.isEmpty()) {
                String date = commits.get(0).path("commit").path("author").path("date").asText("");
                return date.isEmpty() ? Optional.empty() : Optional.of(date);
            }
        } catch (Exception e) {
            log.warn("Could not get commits for {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    private Rule toRule(RuleDto dto) {
        if (dto.filePatterns == null || dto.content == null || dto.version == null) {
            throw new IllegalArgumentException("rule " + dto.id + " needs file_patterns, content and version");
        }
        return new Rule(dto.id, dto.technology, dto.filePatterns, dto.content, dto.version,
                parseTimestamp(dto.updatedAt));
    }

    /**
     * Accepts ISO instants, offset date-times and local date-times (read as UTC).
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException local) {
                e.addSuppressed(local);
                throw new IllegalArgumentException("Invalid updated_at: " + value, e);
            }
        }
    }

    private JsonNode getJson(String pathAndQuery) throws IOException {
        URI uri = URI.create(apiBase + pathAndQuery);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", API_VERSION)
                .timeout(github.getTimeout())
                .GET();
        if (github.hasToken()) {
            builder.header("Authorization", "Bearer " + github.getToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while calling " + uri, e);
        }

        if (response.statusCode() / 100 != 2) {
            log.debug("GitHub API error: {} - {}", response.statusCode(), response.body());
            throw new GitHubApiException(response.statusCode(),
                    "GitHub API error " + response.statusCode() + " for " + uri.getPath());
        }
        return objectMapper.readTree(response.body());
    }

    private String contentsPath(String path) {
        String base = "/repos/" + github.getRepository() + "/contents";
        if (path.isEmpty()) {
            return base;
        }
        return base + "/" + Arrays.stream(path.split("/"))
                .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("/"));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // DTO for JSON deserialization of rule files
    static class RuleDto {
        public String id;
        public String technology;
        @JsonProperty("file_patterns")
        public List<String> filePatterns;
        public Map<String, Object> content;
        public String version;
        @JsonProperty("updated_at")
        public String updatedAt;
    }
}
