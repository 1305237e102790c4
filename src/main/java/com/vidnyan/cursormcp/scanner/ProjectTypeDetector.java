package com.vidnyan.cursormcp.scanner;

import com.vidnyan.cursormcp.domain.technology.TechnologyCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Works out a project's main technology.
 *
 * Marker files in the project root decide first, in catalog order. Without a marker
 * the whole tree is scanned and the most frequent mapped extension wins; on a tie the
 * extension seen first wins.
 */
@Slf4j
@Component
public class ProjectTypeDetector {

    public Optional<String> detectProjectType(Path projectDir) {
        log.info("Detecting project type for: {}", projectDir);

        for (Map.Entry<String, String> marker : TechnologyCatalog.markerFiles().entrySet()) {
            if (Files.exists(projectDir.resolve(marker.getKey()))) {
                log.info("Detected project type: {} based on {}", marker.getValue(), marker.getKey());
                return Optional.of(marker.getValue());
            }
        }

        Optional<String> mostCommon = mostCommonTechnology(countExtensions(projectDir));
        if (mostCommon.isPresent()) {
            log.info("Detected project type: {} based on file extensions", mostCommon.get());
            return mostCommon;
        }

        log.info("Could not detect project type");
        return Optional.empty();
    }

    /**
     * Technology of the mapped extension with the highest count. Ties go to the extension iterated first.
     */
    Optional<String> mostCommonTechnology(Map<String, Integer> extensionCounts) {
        String mostCommon = null;
        int maxCount = 0;
        for (Map.Entry<String, Integer> extension : extensionCounts.entrySet()) {
            Optional<String> technology = TechnologyCatalog.detectableTechnology(extension.getKey());
            if (technology.isPresent() && extension.getValue() > maxCount) {
                mostCommon = technology.get();
                maxCount = extension.getValue();
            }
        }
        return Optional.ofNullable(mostCommon);
    }

    /**
     * File extension counts in the order extensions are first seen.
     */
    Map<String, Integer> countExtensions(Path root) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (!Files.isDirectory(root)) {
            return counts;
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    TechnologyCatalog.extensionOf(file.getFileName().toString())
                            .ifPresent(ext -> counts.merge(ext, 1, Integer::sum));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    log.debug("Skipping unreadable path {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Stopped scanning {} early: {}", root, e.getMessage());
        }
        return counts;
    }
}
