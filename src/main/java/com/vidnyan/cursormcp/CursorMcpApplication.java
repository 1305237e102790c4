package com.vidnyan.cursormcp;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Cursor MCP Server
 *
 * Fetches rule definitions from GitHub, caches them and deploys them into projects.
 */
@SpringBootApplication
public class CursorMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(CursorMcpApplication.class, args);
    }
}
