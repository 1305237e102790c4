package com.vidnyan.cursormcp.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A lint/style/config convention for one technology.
 * The content payload is opaque: linter names, settings and whatever else the rule file carries.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Rule(
    String id,
    String technology,
    @JsonProperty("file_patterns") List<String> filePatterns,
    Map<String, Object> content,
    String version,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public Rule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(technology, "technology");
        filePatterns = filePatterns == null ? List.of() : List.copyOf(filePatterns);
        content = content == null ? Map.of() : content;
    }
}
