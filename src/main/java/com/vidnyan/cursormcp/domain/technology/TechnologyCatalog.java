package com.vidnyan.cursormcp.domain.technology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed lookup tables relating file names, extensions and technologies.
 */
public final class TechnologyCatalog {

    /**
     * Technology used when nothing more specific can be derived.
     */
    public static final String GENERAL = "general";

    /**
     * Technologies advertised by the API. Hardcoded; not derived from the rule repository.
     */
    public static final List<String> ADVERTISED_TECHNOLOGIES = List.of(
            "python", "javascript", "typescript", "rust", "golang",
            "java", "kotlin", "swift", "ruby", "csharp", "php");

    private static final Map<String, String> FILE_EXTENSIONS = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("swift", "swift"),
            Map.entry("go", "golang"),
            Map.entry("rb", "ruby"),
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("cs", "csharp"),
            Map.entry("php", "php"),
            Map.entry("rs", "rust"));

    // Project detection has no Kotlin entry.
    private static final Map<String, String> DETECTABLE_EXTENSIONS = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("java", "java"),
            Map.entry("rb", "ruby"),
            Map.entry("php", "php"),
            Map.entry("go", "golang"),
            Map.entry("rs", "rust"),
            Map.entry("swift", "swift"),
            Map.entry("cs", "csharp"));

    private static final Map<String, String> MARKER_FILES = buildMarkerFiles();

    private static final Pattern TECHNOLOGY_NAME = Pattern.compile("[A-Za-z0-9._+-]+");

    private TechnologyCatalog() {
    }

    private static Map<String, String> buildMarkerFiles() {
        Map<String, String> markers = new LinkedHashMap<>();
        markers.put("package.json", "javascript");
        markers.put("tsconfig.json", "typescript");
        markers.put("requirements.txt", "python");
        markers.put("setup.py", "python");
        markers.put("Cargo.toml", "rust");
        markers.put("go.mod", "golang");
        markers.put("pom.xml", "java");
        markers.put("build.gradle", "java");
        markers.put("Gemfile", "ruby");
        markers.put("composer.json", "php");
        markers.put(".swift-version", "swift");
        markers.put("Package.swift", "swift");
        return Collections.unmodifiableMap(markers);
    }

    /**
     * Map a file extension (without the dot) to a technology, {@link #GENERAL} when unknown.
     */
    public static String technologyForExtension(String extension) {
        if (extension == null) {
            return GENERAL;
        }
        return FILE_EXTENSIONS.getOrDefault(extension, GENERAL);
    }

    /**
     * Technology for a file path, derived from the text after its last dot.
     */
    public static String technologyForPath(String filePath) {
        return technologyForExtension(extensionOf(filePath).orElse(null));
    }

    /**
     * Technology a project-detection extension count maps to, if any.
     */
    public static Optional<String> detectableTechnology(String extension) {
        return Optional.ofNullable(DETECTABLE_EXTENSIONS.get(extension));
    }

    /**
     * Marker file names in precedence order, each mapped to the technology it indicates.
     */
    public static Map<String, String> markerFiles() {
        return MARKER_FILES;
    }

    /**
     * Text after the last dot, or empty when the name has no dot.
     */
    public static Optional<String> extensionOf(String name) {
        if (name == null) {
            return Optional.empty();
        }
        int dot = name.lastIndexOf('.');
        return dot < 0 ? Optional.empty() : Optional.of(name.substring(dot + 1));
    }

    /**
     * Whether the name can safely be used as a directory name under the rules directory.
     */
    public static boolean isValidName(String technology) {
        return technology != null
                && TECHNOLOGY_NAME.matcher(technology).matches()
                && !technology.equals(".")
                && !technology.equals("..");
    }
}
