package com.vidnyan.cursormcp.api;

import com.vidnyan.cursormcp.application.service.RuleDeploymentService;
import com.vidnyan.cursormcp.application.service.RuleManager;
import com.vidnyan.cursormcp.domain.rule.FileContext;
import com.vidnyan.cursormcp.domain.rule.Rule;
import com.vidnyan.cursormcp.domain.rule.RuleSet;
import com.vidnyan.cursormcp.scanner.ProjectTypeDetector;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest
class RulesControllerTest {

    private static final Instant FETCHED_AT = Instant.parse("2024-04-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RuleManager ruleManager;

    @MockBean
    private RuleDeploymentService deploymentService;

    @MockBean
    private ProjectTypeDetector projectTypeDetector;

    @Test
    void listTechnologies_ShouldReturnAdvertisedTechnologies() throws Exception {
        mockMvc.perform(get("/api/v1/technologies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(11)))
                .andExpect(jsonPath("$[0]").value("python"))
                .andExpect(jsonPath("$[10]").value("php"));
    }

    @Test
    void getRulesForTechnology_ShouldRenderSnakeCaseFields() throws Exception {
        when(ruleManager.getRulesForTechnology("python")).thenReturn(pythonRules());

        mockMvc.perform(get("/api/v1/technologies/python/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.fetched_at").value("2024-04-01T12:00:00Z"))
                .andExpect(jsonPath("$.rules[0].id").value("python-linting"))
                .andExpect(jsonPath("$.rules[0].file_patterns[0]").value("*.py"))
                .andExpect(jsonPath("$.rules[0].content.linter").value("ruff"))
                .andExpect(jsonPath("$.rules[0].updated_at").value("2023-10-20T12:00:00Z"))
                .andExpect(jsonPath("$.empty").doesNotExist());
    }

    @Test
    void getRulesForTechnology_ShouldRejectInvalidTechnologyName() throws Exception {
        mockMvc.perform(get("/api/v1/technologies/{technology}/rules", "c#"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid technology name: c#"));

        verifyNoInteractions(ruleManager);
    }

    @Test
    void getRuleById_ShouldReturnRule() throws Exception {
        Rule rule = pythonRules().rules().get(0);
        when(ruleManager.getRuleById("python-linting", "python")).thenReturn(Optional.of(rule));

        mockMvc.perform(get("/api/v1/technologies/python/rules/python-linting"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("1.0.0"));
    }

    @Test
    void getRuleById_ShouldReturnNotFoundWithDetail() throws Exception {
        when(ruleManager.getRuleById("python-missing", "python")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/technologies/python/rules/python-missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Rule python-missing not found for python"));
    }

    @Test
    void getRulesForContext_ShouldPassFileContextToManager() throws Exception {
        when(ruleManager.getRulesForFile(any(FileContext.class))).thenReturn(pythonRules());

        mockMvc.perform(post("/api/v1/context/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"file_path\": \"src/app.py\", \"project_type\": \"python\","
                                + " \"additional_context\": {\"editor\": \"cursor\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1));

        ArgumentCaptor<FileContext> captor = ArgumentCaptor.forClass(FileContext.class);
        verify(ruleManager).getRulesForFile(captor.capture());
        assertEquals("src/app.py", captor.getValue().filePath());
        assertEquals("python", captor.getValue().projectType());
        assertEquals(Map.of("editor", "cursor"), captor.getValue().additionalContext());
    }

    @Test
    void getRulesForContext_ShouldRejectMissingFilePath() throws Exception {
        mockMvc.perform(post("/api/v1/context/rules")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"file_type\": \"py\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail").exists());

        verifyNoInteractions(ruleManager);
    }

    @Test
    void deployRules_ShouldDeployRequestedTechnology() throws Exception {
        when(ruleManager.getRulesForTechnology("python")).thenReturn(pythonRules());
        when(deploymentService.deployRules(Path.of("/work/app"), "python")).thenReturn(true);

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"/work/app\", \"technology\": \"python\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.technology").value("python"))
                .andExpect(jsonPath("$.rules_count").value(1))
                .andExpect(jsonPath("$.target_dir").value("/work/app"));

        verifyNoInteractions(projectTypeDetector);
    }

    @Test
    void deployRules_ShouldDetectTechnologyWhenOmitted() throws Exception {
        when(projectTypeDetector.detectProjectType(Path.of("/work/app"))).thenReturn(Optional.of("python"));
        when(ruleManager.getRulesForTechnology("python")).thenReturn(pythonRules());
        when(deploymentService.deployRules(Path.of("/work/app"), "python")).thenReturn(true);

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"/work/app\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.technology").value("python"));
    }

    @Test
    void deployRules_ShouldFailWhenDetectionFails() throws Exception {
        when(projectTypeDetector.detectProjectType(any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"/work/empty\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail")
                        .value("Could not detect project type. Please specify technology parameter."));

        verifyNoInteractions(ruleManager, deploymentService);
    }

    @Test
    void deployRules_ShouldReturnNotFoundWithoutRules() throws Exception {
        when(ruleManager.getRulesForTechnology("cobol")).thenReturn(RuleSet.of(List.of(), FETCHED_AT));

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"/work/app\", \"technology\": \"cobol\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("No rules found for technology: cobol"));

        verifyNoInteractions(deploymentService);
    }

    @Test
    void deployRules_ShouldReportFailedDeployment() throws Exception {
        when(ruleManager.getRulesForTechnology("python")).thenReturn(pythonRules());
        when(deploymentService.deployRules(any(), anyString())).thenReturn(false);

        mockMvc.perform(post("/api/v1/deploy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"target_dir\": \"/readonly/app\", \"technology\": \"python\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Failed to deploy rules to /readonly/app"));
    }

    @Test
    void unexpectedErrors_ShouldHideDetails() throws Exception {
        when(ruleManager.getRulesForTechnology("python")).thenThrow(new IllegalStateException("disk on fire"));

        mockMvc.perform(get("/api/v1/technologies/python/rules"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value(ApiExceptionHandler.UNEXPECTED_ERROR));
    }

    @Test
    void serviceInfo_ShouldReportRunningAndHealthy() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Cursor MCP Server"))
                .andExpect(jsonPath("$.version").value("1.0.0"))
                .andExpect(jsonPath("$.status").value("running"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    private static RuleSet pythonRules() {
        Rule rule = new Rule("python-linting", "python", List.of("*.py"), Map.of("linter", "ruff"),
                "1.0.0", Instant.parse("2023-10-20T12:00:00Z"));
        return RuleSet.of(List.of(rule), FETCHED_AT);
    }
}
