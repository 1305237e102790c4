package com.vidnyan.cursormcp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Boots the whole application with an unreachable rule repository, so the built-in rules are served.
 */
@SpringBootTest
@AutoConfigureMockMvc
class CursorMcpApplicationTest {

    @TempDir
    static Path workDir;

    @Autowired
    private MockMvc mockMvc;

    @DynamicPropertySource
    static void ruleProperties(DynamicPropertyRegistry registry) {
        registry.add("cursor.rules.github.api-url", () -> "http://127.0.0.1:1");
        registry.add("cursor.rules.github.timeout", () -> "2s");
        registry.add("cursor.rules.local-path", () -> workDir.resolve("rules").toString());
    }

    @Test
    void rulesEndpoint_ShouldServeAndStoreBuiltInRules() throws Exception {
        mockMvc.perform(get("/api/v1/technologies/python/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(2))
                .andExpect(jsonPath("$.rules[0].id").value("python-linting"))
                .andExpect(jsonPath("$.rules[1].id").value("python-typing"));

        assertTrue(Files.isRegularFile(workDir.resolve("rules/python/python-linting.json")));
        assertTrue(Files.isRegularFile(workDir.resolve("rules/python/python-typing.json")));
    }

    @Test
    void rulesEndpoint_ShouldReturnEmptySetForUnknownTechnology() throws Exception {
        mockMvc.perform(get("/api/v1/technologies/cobol/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(0));
    }

    @Test
    void deployEndpoint_ShouldDetectProjectAndWriteRules() throws Exception {
        Path project = Files.createDirectories(workDir.resolve("service"));
        Files.writeString(project.resolve("requirements.txt"), "requests==2.31.0");

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"" + project.toString().replace("\\", "\\\\") + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.technology").value("python"))
                .andExpect(jsonPath("$.rules_count").value(2));

        assertTrue(Files.isRegularFile(project.resolve(".cursor-rules/python/python-typing.json")));
        assertTrue(Files.isRegularFile(project.resolve(".cursor-rules/index.json")));
    }

    @Test
    void healthEndpoint_ShouldReportHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }
}
