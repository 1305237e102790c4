package com.vidnyan.cursormcp.api;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class ServiceInfoController {

    static final String NAME = "Cursor MCP Server";
    static final String VERSION = "1.0.0";

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of(
                "name", NAME,
                "version", VERSION,
                "status", "running");
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
