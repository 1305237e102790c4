package com.vidnyan.cursormcp.domain.rule;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.cursormcp.domain.technology.TechnologyCatalog;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Information about a file the caller wants rules for.
 * Only used to work out which technology's rules apply.
 */
public record FileContext(
    @NotBlank @JsonProperty("file_path") String filePath,
    @JsonProperty("file_type") String fileType,
    @JsonProperty("project_type") String projectType,
    @JsonProperty("additional_context") Map<String, Object> additionalContext
) {

    public static FileContext forPath(String filePath) {
        return new FileContext(filePath, null, null, null);
    }

    /**
     * A known project type wins over anything derived from the file itself.
     */
    public String resolveTechnology() {
        if (projectType != null && !projectType.isBlank()) {
            return projectType;
        }
        if (fileType != null && !fileType.isBlank()) {
            return TechnologyCatalog.technologyForExtension(
                    fileType.startsWith(".") ? fileType.substring(1) : fileType);
        }
        return TechnologyCatalog.technologyForPath(filePath);
    }
}
