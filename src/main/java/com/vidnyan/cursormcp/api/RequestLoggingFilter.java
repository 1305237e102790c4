package com.vidnyan.cursormcp.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;

/**
 * Logs method, path, status and duration of every request.
 */
@Slf4j
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            log.info("{} {} - {} - {}s", request.getMethod(), request.getRequestURI(),
                    response.getStatus(), String.format(Locale.ROOT, "%.4f", seconds));
        }
    }
}
