package com.vidnyan.cursormcp.adapter.out.github;

/**
 * Non-2xx answer from the GitHub REST API.
 */
public class GitHubApiException extends RuntimeException {

    private final int statusCode;

    public GitHubApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
