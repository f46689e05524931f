package com.openforge.toolbridge.adapter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Connection settings for the JSONPlaceholder-style REST backend.
 *
 * agent:
 *   adapters:
 *     jsonplaceholder:
 *       base-url: https://jsonplaceholder.typicode.com
 *       timeout-seconds: 5
 */
@ConfigurationProperties(prefix = "agent.adapters.jsonplaceholder")
public record JsonPlaceholderProperties(
        @DefaultValue("https://jsonplaceholder.typicode.com") String baseUrl,
        @DefaultValue("5") int timeoutSeconds
) {

    /** Base URL without a trailing slash. */
    public String normalizedBaseUrl() {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
