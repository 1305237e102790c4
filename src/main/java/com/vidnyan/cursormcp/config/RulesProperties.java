package com.vidnyan.cursormcp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for rule fetching, caching and local storage.
 * Bound from application.properties, which maps them to environment variables.
 */
@Data
@Component
@ConfigurationProperties(prefix = "cursor.rules")
public class RulesProperties {

    private final Github github = new Github();

    /**
     * How long a fetched rule set is served from memory.
     * Plain numbers are seconds.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cacheTtl = Duration.ofHours(1);

    /**
     * Directory where fetched rules are written, one sub-directory per technology.
     */
    private String localPath = "./rules";

    public Path rulesDirectory() {
        return Path.of(localPath);
    }

    @Data
    public static class Github {

        /**
         * Access token. Empty means anonymous access.
         */
        private String token = "";

        /**
         * Repository in owner/name form.
         */
        private String repository = "ololo-tratata/cursor-rules";

        private String apiUrl = "https://api.github.com";

        private Duration timeout = Duration.ofSeconds(30);

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }
}
